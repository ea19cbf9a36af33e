package com.overseer.config;

import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Worker 配置绑定：overseer.worker.* → {@link WorkerConfig}。
 */
@Configuration
public class WorkerConfigConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "overseer.worker")
    public WorkerConfig workerConfig() {
        return new WorkerConfig();
    }
}
