package com.contractmind.config;

import com.contractmind.domain.intent.model.valobj.IntentParserSettingsVO;
import com.contractmind.domain.transaction.model.valobj.ChainSettingsVO;
import com.contractmind.domain.transaction.model.valobj.CoercionSettingsVO;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 将配置属性转换为领域层的不可变配置值对象。
 */
@Configuration
public class DomainSettingsConfig {

    @Bean
    public ChainSettingsVO chainSettings(BlockchainProperties properties) {
        return ChainSettingsVO.builder()
                .chainId(properties.getChainId())
                .networkName(properties.getNetworkName())
                .hubAddress(properties.getHubAddress())
                .registryAddress(properties.getAgentRegistryAddress())
                .receiptTimeoutSeconds(properties.getReceiptTimeoutSeconds())
                .build();
    }

    @Bean
    public CoercionSettingsVO coercionSettings(PipelineProperties properties) {
        Map<String, Integer> tokenDecimals = new LinkedHashMap<>();
        properties.getTokenDecimals().forEach((token, decimals) -> tokenDecimals.put(token.toUpperCase(Locale.ROOT), decimals));
        return CoercionSettingsVO.builder()
                .defaultDecimals(properties.getDefaultDecimals())
                .tokenDecimals(tokenDecimals)
                .functionDecimals(new LinkedHashMap<>(properties.getFunctionDecimals()))
                .build();
    }

    @Bean
    public IntentParserSettingsVO intentParserSettings(LlmProperties properties) {
        return IntentParserSettingsVO.builder()
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                .historyWindow(properties.getHistoryWindow())
                .build();
    }
}
