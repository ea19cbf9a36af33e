package com.overseer.trigger.application.command;

import com.overseer.api.dto.WorkItemSubmitRequestDTO;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workqueue.adapter.repository.IWorkItemRepository;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.enums.WorkItemPriorityEnum;
import com.overseer.types.enums.WorkItemStatusEnum;
import com.overseer.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 工作项写操作：入队与取消。
 */
@Slf4j
@Service
public class WorkItemCommandService {

    private static final String CANCEL_REASON = "cancelled by request";
    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final IWorkItemRepository workItemRepository;
    private final WorkflowCancellationRegistry cancellationRegistry;
    private final WorkerConfig workerConfig;

    public WorkItemCommandService(IWorkItemRepository workItemRepository,
                                  WorkflowCancellationRegistry cancellationRegistry,
                                  WorkerConfig workerConfig) {
        this.workItemRepository = workItemRepository;
        this.cancellationRegistry = cancellationRegistry;
        this.workerConfig = workerConfig;
    }

    public WorkItemEntity submit(WorkItemSubmitRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getTitle())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "title不能为空");
        }
        WorkItemPriorityEnum priority;
        try {
            priority = WorkItemPriorityEnum.fromCodeOrDefault(request.getPriority(), WorkItemPriorityEnum.MEDIUM);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage(), ex);
        }
        WorkItemEntity item = new WorkItemEntity();
        item.setQueueId(StringUtils.defaultIfBlank(request.getQueueId(), workerConfig.getQueueId()));
        item.setTitle(request.getTitle().trim());
        item.setDescription(request.getDescription());
        item.setPriority(priority);
        item.setWorkstream(StringUtils.trimToNull(request.getWorkstream()));
        item.setStatus(WorkItemStatusEnum.PENDING);
        WorkItemEntity saved = workItemRepository.save(item);
        log.info("Work item submitted. workItemId={}, queueId={}, priority={}",
                saved.getId(), saved.getQueueId(), saved.getPriority().getCode());
        return saved;
    }

    /**
     * 取消工作项；运行中的工作流同时收到取消信号，在下一个阶段边界结束为 failed。
     * <p>
     * 写入以读取时的状态为条件，与守护任务的回写并发时不会覆盖已结束的工作项。
     * </p>
     */
    public WorkItemEntity cancel(String workItemId) {
        for (int attempt = 1; attempt <= MAX_CANCEL_ATTEMPTS; attempt++) {
            WorkItemEntity item = workItemRepository.findById(workItemId);
            if (item == null) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "工作项不存在: " + workItemId);
            }
            WorkItemStatusEnum observed = item.getStatus();
            if (observed != null && observed.isTerminal()) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                        "工作项已结束，无法取消: " + observed.getCode());
            }
            item.cancel(CANCEL_REASON);
            if (workItemRepository.updateIfStatus(item, observed)) {
                boolean signalled = cancellationRegistry.cancel(workItemId);
                log.info("Work item cancelled. workItemId={}, runningWorkflowSignalled={}", workItemId, signalled);
                return item;
            }
            log.info("Work item changed while cancelling, retry. workItemId={}, attempt={}", workItemId, attempt);
        }
        throw new AppException(ResponseCode.UN_ERROR.getCode(), "工作项状态持续变化，取消失败: " + workItemId);
    }
}
