package com.contractmind.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 公共线程池配置。
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Slf4j
@EnableAsync
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "commonThreadPoolExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "commonThreadPoolExecutor")
    public ThreadPoolExecutor commonThreadPoolExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        AtomicInteger threadIndex = new AtomicInteger(0);
        String prefix = properties.getThreadNamePrefix();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        log.info("THREAD_POOL_INIT name=commonThreadPoolExecutor, core={}, max={}, queue={}, policy={}",
                coreSize, maxSize, properties.getBlockQueueSize(), properties.getPolicy());
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    static RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        if (!"CallerRunsPolicy".equals(policy)) {
            log.warn("Unknown rejection policy '{}', fallback to CallerRunsPolicy", policy);
        }
        return new ThreadPoolExecutor.CallerRunsPolicy();
    }

}
