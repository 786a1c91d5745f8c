package com.contractmind.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 意图管线配置，前缀 {@code contractmind.pipeline}。
 */
@Data
@ConfigurationProperties(prefix = "contractmind.pipeline", ignoreInvalidFields = true)
public class PipelineProperties {

    /** 函数目录缓存时间（分钟） */
    private long catalogCacheMinutes = 10L;

    /** 函数目录缓存最大条目数 */
    private long catalogCacheMaxSize = 1000L;

    /** 默认代币精度 */
    private int defaultDecimals = 18;

    /** 代币符号 → 精度，例如 USDC: 6 */
    private Map<String, Integer> tokenDecimals = new LinkedHashMap<>();

    /** 函数名 → 精度 */
    private Map<String, Integer> functionDecimals = new LinkedHashMap<>();
}
