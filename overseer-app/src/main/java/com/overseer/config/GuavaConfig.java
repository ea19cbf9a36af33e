package com.overseer.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.overseer.domain.workflow.model.entity.WorkflowStateEntity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * workflowStateCache 保存每个工作项最近一次工作流运行的终态，写入后按保留时长过期，并限制条目数。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "workflowStateCache")
    public Cache<String, WorkflowStateEntity> workflowStateCache(
            @Value("${overseer.state.retention-minutes:1440}") long retentionMinutes,
            @Value("${overseer.state.max-entries:10000}") long maxEntries) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(retentionMinutes, 1L), TimeUnit.MINUTES)
                .maximumSize(Math.max(maxEntries, 1L))
                .build();
    }

}
