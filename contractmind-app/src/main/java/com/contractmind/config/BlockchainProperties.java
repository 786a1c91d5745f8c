package com.contractmind.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 链配置，前缀 {@code contractmind.blockchain}。
 */
@Data
@ConfigurationProperties(prefix = "contractmind.blockchain", ignoreInvalidFields = true)
public class BlockchainProperties {

    /** JSON-RPC 节点地址 */
    private String rpcUrl = "https://bsc-testnet-rpc.publicnode.com";

    private long chainId = 50312L;

    private String networkName = "Somnia Testnet";

    /** 受信任 Hub 合约地址，为空时所有交易直连目标合约 */
    private String hubAddress;

    /** Agent 注册表合约地址 */
    private String agentRegistryAddress;

    /** 等待回执超时（秒） */
    private int receiptTimeoutSeconds = 30;

    /** 回执轮询间隔（毫秒） */
    private long receiptPollIntervalMillis = 1000L;
}
