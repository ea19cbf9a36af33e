package com.overseer.domain.workqueue.service;

import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.types.enums.WorkItemPriorityEnum;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * 工作项领取顺序领域服务：优先级高者先领，同优先级按创建时间先后。
 */
@Service
public class WorkItemSelectionDomainService {

    private static final Comparator<WorkItemEntity> CLAIM_ORDER = Comparator
            .comparingInt((WorkItemEntity item) -> priorityRank(item.getPriority()))
            .thenComparing(WorkItemEntity::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(WorkItemEntity::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    public WorkItemEntity selectNext(List<WorkItemEntity> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        return candidates.stream()
                .filter(item -> item != null && item.isClaimable())
                .min(CLAIM_ORDER)
                .orElse(null);
    }

    private static int priorityRank(WorkItemPriorityEnum priority) {
        return priority == null ? WorkItemPriorityEnum.MEDIUM.getRank() : priority.getRank();
    }
}
