package com.contractmind.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置，前缀 {@code contractmind.http-log}。
 */
@Data
@ConfigurationProperties(prefix = "contractmind.http-log", ignoreInvalidFields = true)
public class HttpTraceLogProperties {

    private boolean enabled = true;

    /** 需要记录日志的路径模式 */
    private List<String> includePathPatterns = Arrays.asList("/api/**");

    /** 请求体摘要白名单字段，未列出的字段不进入日志 */
    private List<String> requestBodyWhitelist = Arrays.asList("agentId", "userAddress", "functionName", "txHash");

    /** 慢请求阈值（毫秒），超过时额外输出 HTTP_SLOW */
    private long slowRequestThresholdMs = 3000L;

    private int maxBodyLength = 512;
}
