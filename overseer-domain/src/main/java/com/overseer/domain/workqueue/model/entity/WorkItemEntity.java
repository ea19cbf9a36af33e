package com.overseer.domain.workqueue.model.entity;

import com.overseer.types.enums.WorkItemPriorityEnum;
import com.overseer.types.enums.WorkItemStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 工作项领域实体
 * <p>
 * 由外部队列持有，对工作流引擎而言是只读输入；
 * 状态推进只发生在队列侧（领取、回写结果、取消）。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Data
public class WorkItemEntity {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 所属队列 ID
     */
    private String queueId;

    /**
     * 标题
     */
    private String title;

    /**
     * 描述
     */
    private String description;

    /**
     * 状态
     */
    private WorkItemStatusEnum status;

    /**
     * 状态原因（失败原因 / 取消原因）
     */
    private String statusReason;

    /**
     * 优先级
     */
    private WorkItemPriorityEnum priority;

    /**
     * 工作流标签
     */
    private String workstream;

    /**
     * 领取该工作项的会话 Key
     */
    private String assignedSessionKey;

    /**
     * 开始执行时间
     */
    private LocalDateTime startedAt;

    /**
     * 结束时间
     */
    private LocalDateTime completedAt;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 验证工作项是否有效
     */
    public void validate() {
        if (queueId == null || queueId.trim().isEmpty()) {
            throw new IllegalStateException("Queue ID cannot be empty");
        }
        if (title == null || title.trim().isEmpty()) {
            throw new IllegalStateException("Title cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (priority == null) {
            throw new IllegalStateException("Priority cannot be null");
        }
    }

    /**
     * 领取
     */
    public void claim(String sessionKey) {
        if (this.status != WorkItemStatusEnum.PENDING) {
            throw new IllegalStateException("Work item must be in PENDING status to be claimed");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = WorkItemStatusEnum.IN_PROGRESS;
        this.assignedSessionKey = sessionKey;
        this.statusReason = null;
        this.startedAt = now;
        this.updatedAt = now;
    }

    /**
     * 退回队列：in_progress → pending，清空领取信息
     */
    public void release(String reason) {
        if (this.status != WorkItemStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress work items can be released");
        }
        this.status = WorkItemStatusEnum.PENDING;
        this.statusReason = reason;
        this.assignedSessionKey = null;
        this.startedAt = null;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 完成
     */
    public void complete() {
        if (this.status != WorkItemStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress work items can be completed");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = WorkItemStatusEnum.COMPLETED;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 标记为失败
     */
    public void fail(String reason) {
        LocalDateTime now = LocalDateTime.now();
        this.status = WorkItemStatusEnum.FAILED;
        this.statusReason = reason;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 取消
     */
    public void cancel(String reason) {
        if (this.status != null && this.status.isTerminal()) {
            throw new IllegalStateException("Cannot cancel completed, failed or cancelled work items");
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = WorkItemStatusEnum.CANCELLED;
        this.statusReason = reason;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 检查是否可被领取
     */
    public boolean isClaimable() {
        return this.status == WorkItemStatusEnum.PENDING;
    }
}
