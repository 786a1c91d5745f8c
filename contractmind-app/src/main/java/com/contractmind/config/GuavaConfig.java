package com.contractmind.config;

import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 本地缓存配置。
 * <p>
 * 函数目录按 agentId 缓存，授权位或 ABI 变更时由领域服务主动失效。
 * </p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "functionCatalogCache")
    public Cache<String, FunctionCatalogVO> functionCatalogCache(PipelineProperties properties) {
        return CacheBuilder.newBuilder()
                .maximumSize(Math.max(properties.getCatalogCacheMaxSize(), 1L))
                .expireAfterWrite(Math.max(properties.getCatalogCacheMinutes(), 1L), TimeUnit.MINUTES)
                .build();
    }

}
