package com.overseer.trigger.job;

import com.overseer.domain.workflow.adapter.repository.IWorkflowStateRepository;
import com.overseer.domain.workflow.model.entity.WorkflowStateEntity;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workflow.model.valobj.WorkflowCancellation;
import com.overseer.domain.workflow.service.WorkflowEngine;
import com.overseer.domain.workflow.service.WorkflowSessionKeys;
import com.overseer.domain.workqueue.adapter.repository.IWorkItemRepository;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.trigger.application.command.WorkflowCancellationRegistry;
import com.overseer.types.enums.WorkItemStatusEnum;
import com.overseer.types.enums.WorkflowPhaseEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 工作队列守护任务：领取待处理工作项并交给工作流引擎执行。
 * <p>
 * 调度线程只负责领取与提交，工作流本身在 workflowExecutionWorker 线程池中运行；
 * 同时运行的工作流不超过 concurrencyLimit。
 * </p>
 */
@Slf4j
@Component
public class WorkQueueWorkerDaemon {

    private static final String MDC_WORK_ITEM_ID = "workItemId";

    private final IWorkItemRepository workItemRepository;
    private final IWorkflowStateRepository workflowStateRepository;
    private final WorkflowEngine workflowEngine;
    private final WorkerConfig workerConfig;
    private final WorkflowCancellationRegistry cancellationRegistry;
    private final Executor workflowExecutionWorker;
    private final AtomicInteger runningWorkflows = new AtomicInteger(0);
    private final Counter startedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter rejectedCounter;

    public WorkQueueWorkerDaemon(IWorkItemRepository workItemRepository,
                                 IWorkflowStateRepository workflowStateRepository,
                                 WorkflowEngine workflowEngine,
                                 WorkerConfig workerConfig,
                                 WorkflowCancellationRegistry cancellationRegistry,
                                 @Qualifier("workflowExecutionWorker") Executor workflowExecutionWorker) {
        this.workItemRepository = workItemRepository;
        this.workflowStateRepository = workflowStateRepository;
        this.workflowEngine = workflowEngine;
        this.workerConfig = workerConfig;
        this.cancellationRegistry = cancellationRegistry;
        this.workflowExecutionWorker = workflowExecutionWorker;
        this.startedCounter = Counter.builder("overseer.workflow.started.total").register(Metrics.globalRegistry);
        this.completedCounter = Counter.builder("overseer.workflow.completed.total").register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("overseer.workflow.failed.total").register(Metrics.globalRegistry);
        this.rejectedCounter = Counter.builder("overseer.workflow.rejected.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${overseer.worker.poll-interval-ms:2000}", scheduler = "daemonScheduler")
    public void pollWorkQueue() {
        if (!workerConfig.isEnabled() || !workerConfig.isWorkflowEnabled()) {
            return;
        }
        String sessionKey = WorkflowSessionKeys.worker(workerConfig.getAgentId(), workerConfig.getQueueId());
        int freeSlots = Math.max(workerConfig.getConcurrencyLimit(), 1) - runningWorkflows.get();
        while (freeSlots > 0) {
            WorkItemEntity item = workItemRepository.claimNext(workerConfig.getQueueId(), sessionKey);
            if (item == null) {
                return;
            }
            if (!submit(item)) {
                return;
            }
            freeSlots--;
        }
    }

    public int getRunningWorkflows() {
        return runningWorkflows.get();
    }

    private boolean submit(WorkItemEntity item) {
        WorkflowCancellation cancellation = cancellationRegistry.register(item.getId());
        runningWorkflows.incrementAndGet();
        try {
            workflowExecutionWorker.execute(() -> runWorkItem(item, cancellation));
            log.info("Work item claimed. workItemId={}, queueId={}, priority={}",
                    item.getId(), item.getQueueId(), item.getPriority() == null ? null : item.getPriority().getCode());
            return true;
        } catch (RejectedExecutionException ex) {
            runningWorkflows.decrementAndGet();
            cancellationRegistry.remove(item.getId());
            rejectedCounter.increment();
            log.warn("Workflow worker rejected work item, releasing it. workItemId={}, error={}",
                    item.getId(), ex.getMessage());
            releaseQuietly(item, "worker busy");
            return false;
        }
    }

    private void runWorkItem(WorkItemEntity item, WorkflowCancellation cancellation) {
        MDC.put(MDC_WORK_ITEM_ID, item.getId());
        try {
            WorkItemEntity current = workItemRepository.findById(item.getId());
            if (current == null || current.getStatus() != WorkItemStatusEnum.IN_PROGRESS) {
                log.info("Skip workflow because work item is no longer in progress. workItemId={}, status={}",
                        item.getId(), current == null || current.getStatus() == null ? null : current.getStatus().getCode());
                return;
            }
            startedCounter.increment();
            WorkflowStateEntity state = workflowEngine.executeWorkflow(current, cancellation);
            workflowStateRepository.save(state);
            if (state.getPhase() == WorkflowPhaseEnum.COMPLETED) {
                completedCounter.increment();
            } else {
                failedCounter.increment();
            }
            writeBack(item.getId(), state);
        } catch (Exception ex) {
            log.error("Workflow run crashed. workItemId={}, error={}", item.getId(), ex.getMessage(), ex);
        } finally {
            cancellationRegistry.remove(item.getId());
            runningWorkflows.decrementAndGet();
            MDC.remove(MDC_WORK_ITEM_ID);
        }
    }

    private void writeBack(String workItemId, WorkflowStateEntity state) {
        WorkItemEntity latest = workItemRepository.findById(workItemId);
        if (latest == null) {
            log.warn("Work item disappeared before write-back. workItemId={}", workItemId);
            return;
        }
        if (latest.getStatus() != WorkItemStatusEnum.IN_PROGRESS) {
            log.info("Keep work item status set while the workflow ran. workItemId={}, status={}, phase={}",
                    workItemId, latest.getStatus().getCode(), state.getPhase().getCode());
            return;
        }
        if (state.getPhase() == WorkflowPhaseEnum.COMPLETED) {
            latest.complete();
        } else {
            latest.fail(state.getError());
        }
        if (!workItemRepository.updateIfStatus(latest, WorkItemStatusEnum.IN_PROGRESS)) {
            log.info("Work item changed during write-back, keep it. workItemId={}, phase={}",
                    workItemId, state.getPhase().getCode());
            return;
        }
        log.info("Work item finished. workItemId={}, status={}, phase={}, error={}",
                workItemId, latest.getStatus().getCode(), state.getPhase().getCode(), state.getError());
    }

    private void releaseQuietly(WorkItemEntity item, String reason) {
        try {
            item.release(reason);
            if (!workItemRepository.updateIfStatus(item, WorkItemStatusEnum.IN_PROGRESS)) {
                log.info("Work item changed before release, keep it. workItemId={}", item.getId());
            }
        } catch (Exception ex) {
            log.warn("Failed to release work item. workItemId={}, error={}", item.getId(), ex.getMessage());
        }
    }
}
