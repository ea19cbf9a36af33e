package com.overseer.infrastructure.repository.workqueue;

import com.overseer.domain.workqueue.adapter.repository.IWorkItemRepository;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.domain.workqueue.service.WorkItemSelectionDomainService;
import com.overseer.types.enums.WorkItemPriorityEnum;
import com.overseer.types.enums.WorkItemStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 进程内工作项仓储实现。
 * <p>
 * 存取均为副本，调用方修改实体后需 updateIfStatus 才生效；条件写入与 claimNext 共用仓储锁。
 * </p>
 */
@Repository
public class InMemoryWorkItemRepositoryImpl implements IWorkItemRepository {

    private final Map<String, WorkItemEntity> items = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final WorkItemSelectionDomainService workItemSelectionDomainService;

    public InMemoryWorkItemRepositoryImpl(WorkItemSelectionDomainService workItemSelectionDomainService) {
        this.workItemSelectionDomainService = workItemSelectionDomainService;
    }

    @Override
    public synchronized WorkItemEntity save(WorkItemEntity item) {
        if (StringUtils.isBlank(item.getId())) {
            item.setId(String.format("wi-%06d", sequence.incrementAndGet()));
        }
        if (item.getStatus() == null) {
            item.setStatus(WorkItemStatusEnum.PENDING);
        }
        if (item.getPriority() == null) {
            item.setPriority(WorkItemPriorityEnum.MEDIUM);
        }
        LocalDateTime now = LocalDateTime.now();
        if (item.getCreatedAt() == null) {
            item.setCreatedAt(now);
        }
        item.setUpdatedAt(now);
        item.validate();
        items.put(item.getId(), copy(item));
        return copy(item);
    }

    @Override
    public synchronized boolean updateIfStatus(WorkItemEntity item, WorkItemStatusEnum expectedStatus) {
        WorkItemEntity stored = item == null || StringUtils.isBlank(item.getId()) ? null : items.get(item.getId());
        if (stored == null) {
            throw new IllegalStateException("Work item not found: " + (item == null ? null : item.getId()));
        }
        if (stored.getStatus() != expectedStatus) {
            return false;
        }
        item.validate();
        item.setUpdatedAt(LocalDateTime.now());
        items.put(item.getId(), copy(item));
        return true;
    }

    @Override
    public WorkItemEntity findById(String id) {
        if (StringUtils.isBlank(id)) {
            return null;
        }
        return copy(items.get(id));
    }

    @Override
    public List<WorkItemEntity> listByQueue(String queueId) {
        return items.values().stream()
                .filter(item -> StringUtils.equals(item.getQueueId(), queueId))
                .sorted(Comparator.comparing(WorkItemEntity::getCreatedAt).thenComparing(WorkItemEntity::getId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized WorkItemEntity claimNext(String queueId, String sessionKey) {
        List<WorkItemEntity> candidates = new ArrayList<>();
        for (WorkItemEntity item : items.values()) {
            if (StringUtils.equals(item.getQueueId(), queueId)) {
                candidates.add(item);
            }
        }
        WorkItemEntity next = workItemSelectionDomainService.selectNext(candidates);
        if (next == null) {
            return null;
        }
        next.claim(sessionKey);
        return copy(next);
    }

    private WorkItemEntity copy(WorkItemEntity source) {
        if (source == null) {
            return null;
        }
        WorkItemEntity target = new WorkItemEntity();
        target.setId(source.getId());
        target.setQueueId(source.getQueueId());
        target.setTitle(source.getTitle());
        target.setDescription(source.getDescription());
        target.setStatus(source.getStatus());
        target.setStatusReason(source.getStatusReason());
        target.setPriority(source.getPriority());
        target.setWorkstream(source.getWorkstream());
        target.setAssignedSessionKey(source.getAssignedSessionKey());
        target.setStartedAt(source.getStartedAt());
        target.setCompletedAt(source.getCompletedAt());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
