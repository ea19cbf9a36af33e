package com.overseer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 两个相互隔离的线程池：
 * <ul>
 *   <li>workflowExecutionWorker：每个工作流运行占用一个线程，默认不排队，满载时由守护任务退回队列</li>
 *   <li>joinBarrierExecutor：等待屏障的并发 agent.wait，工作流线程池占满时仍可推进；超出线程数的条目进入有界队列</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ExecutorPoolProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "workflowExecutionWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "workflowExecutionWorker")
    public ThreadPoolExecutor workflowExecutionWorker(ExecutorPoolProperties properties) {
        return buildExecutor(properties.getWorker(), "workflow-worker-");
    }

    @Bean(name = "joinBarrierExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "joinBarrierExecutor")
    public ThreadPoolExecutor joinBarrierExecutor(ExecutorPoolProperties properties) {
        return buildExecutor(properties.getBarrier(), "join-barrier-");
    }

    private ThreadPoolExecutor buildExecutor(ExecutorPoolProperties.Pool pool, String defaultPrefix) {
        int coreSize = Math.max(pool.getCoreSize(), 1);
        int maxSize = Math.max(pool.getMaxSize(), coreSize);
        int queueCapacity = Math.max(pool.getQueueCapacity(), 0);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        String threadNamePrefix = pool.getThreadNamePrefix() == null ? defaultPrefix : pool.getThreadNamePrefix();
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(pool.getKeepAliveSeconds(), 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(pool.getRejectionPolicy()));
        log.info("Thread pool created. prefix={}, coreSize={}, maxSize={}, queueCapacity={}",
                threadNamePrefix, coreSize, maxSize, queueCapacity);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
