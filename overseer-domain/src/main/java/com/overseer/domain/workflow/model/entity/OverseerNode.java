package com.overseer.domain.workflow.model.entity;

import com.overseer.types.enums.NodeStatusEnum;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 执行树节点基类（phase / task / subtask）。
 * <p>
 * 状态只能 todo → in_progress → done|failed 单向推进；
 * 终态节点不可再变更，状态只能经由下列方法修改。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Getter
public abstract class OverseerNode {

    /**
     * 层级 ID，如 P1 / P1.T2 / P1.T2.S3
     */
    @Setter
    private String id;

    /**
     * 名称
     */
    @Setter
    private String name;

    /**
     * 状态
     */
    private NodeStatusEnum status = NodeStatusEnum.TODO;

    /**
     * 验收标准
     */
    @Setter
    private List<String> acceptanceCriteria = new ArrayList<>();

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    protected OverseerNode() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * 开始执行
     */
    public void start() {
        if (this.status != NodeStatusEnum.TODO) {
            throw new IllegalStateException("Node must be in TODO status to start: " + id);
        }
        this.status = NodeStatusEnum.IN_PROGRESS;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 完成
     */
    public void markDone() {
        if (this.status != NodeStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress nodes can be marked done: " + id);
        }
        this.status = NodeStatusEnum.DONE;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 标记为失败，允许从 todo 直接失败（父节点因子节点失败而失败）。
     */
    public void markFailed() {
        if (this.status != null && this.status.isTerminal()) {
            throw new IllegalStateException("Terminal nodes cannot be marked failed: " + id);
        }
        this.status = NodeStatusEnum.FAILED;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isDone() {
        return this.status == NodeStatusEnum.DONE;
    }

    public boolean isFailed() {
        return this.status == NodeStatusEnum.FAILED;
    }
}
