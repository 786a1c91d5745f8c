package com.contractmind.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 客户端配置。
 */
@Slf4j
@Configuration
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(BlockchainProperties properties) {
        log.info("WEB3J_INIT rpcUrl={}, chainId={}", properties.getRpcUrl(), properties.getChainId());
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }
}
