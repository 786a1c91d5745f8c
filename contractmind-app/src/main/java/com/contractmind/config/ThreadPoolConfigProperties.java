package com.contractmind.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 公共线程池配置属性，前缀 {@code thread.pool.executor.config}。
 * <p>
 * 该线程池承载 LLM 调用、遥测投递与 WebSocket 管线任务。
 * </p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认8 */
    private Integer corePoolSize = 8;

    /** 最大线程数，默认64 */
    private Integer maxPoolSize = 64;

    /** 空闲线程最大存活时间（秒），默认30 */
    private Long keepAliveTime = 30L;

    /** 阻塞队列最大容量，默认1000 */
    private Integer blockQueueSize = 1000;

    /** 线程名前缀 */
    private String threadNamePrefix = "contractmind-worker-";

    /**
     * 拒绝策略，默认 CallerRunsPolicy：AbortPolicy / DiscardPolicy / DiscardOldestPolicy / CallerRunsPolicy
     */
    private String policy = "CallerRunsPolicy";

}
