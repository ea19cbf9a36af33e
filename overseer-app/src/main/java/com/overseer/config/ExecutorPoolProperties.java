package com.overseer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 线程池配置属性，前缀 overseer.executor。
 * <p>
 * worker 承载整个工作流运行，barrier 承载等待屏障的并发 agent.wait；两者必须分开。
 * barrier 使用有界队列 + AbortPolicy，屏障条目不会回落到调用方线程执行。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Data
@ConfigurationProperties(prefix = "overseer.executor", ignoreInvalidFields = true)
public class ExecutorPoolProperties {

    private Pool worker = new Pool(2, 2, 0, "workflow-worker-");

    private Pool barrier = new Pool(32, 32, 1024, "join-barrier-");

    @Data
    public static class Pool {

        /** 核心线程数 */
        private int coreSize;

        /** 最大线程数 */
        private int maxSize;

        /** 空闲线程存活时间（秒） */
        private long keepAliveSeconds = 60L;

        /** 队列容量，0 表示直接移交（SynchronousQueue） */
        private int queueCapacity;

        /** 拒绝策略：AbortPolicy/DiscardPolicy/DiscardOldestPolicy/CallerRunsPolicy */
        private String rejectionPolicy = "AbortPolicy";

        private String threadNamePrefix;

        public Pool() {
        }

        public Pool(int coreSize, int maxSize, int queueCapacity, String threadNamePrefix) {
            this.coreSize = coreSize;
            this.maxSize = maxSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
