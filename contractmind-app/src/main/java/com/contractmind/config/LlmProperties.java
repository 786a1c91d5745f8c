package com.contractmind.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 大模型意图解析配置，前缀 {@code contractmind.llm}。
 */
@Data
@ConfigurationProperties(prefix = "contractmind.llm", ignoreInvalidFields = true)
public class LlmProperties {

    private double temperature = 0.7D;

    private int maxTokens = 2000;

    /** 写入提示词的最近对话条数 */
    private int historyWindow = 4;

    /** 单次调用超时（秒） */
    private long timeoutSeconds = 30L;
}
