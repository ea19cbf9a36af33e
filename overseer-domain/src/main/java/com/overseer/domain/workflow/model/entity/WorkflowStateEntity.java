package com.overseer.domain.workflow.model.entity;

import com.overseer.domain.workflow.model.valobj.DiscoveryResult;
import com.overseer.domain.workflow.model.valobj.ExecutionProgress;
import com.overseer.domain.workflow.model.valobj.ReviewIteration;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.types.enums.WorkflowPhaseEnum;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次工作流运行的状态记录
 * <p>
 * 不暴露 setter，只能通过阶段推进方法修改，每个方法校验当前阶段：
 * <ul>
 *   <li>未到达阶段的字段保持为空</li>
 *   <li>completedAt 当且仅当处于 completed/failed 时非空</li>
 *   <li>error 当且仅当处于 failed 时非空</li>
 * </ul>
 * 运行期间由引擎独占，结束后按值返回给调用方。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Getter
@ToString
public class WorkflowStateEntity {

    /**
     * 当前阶段
     */
    private WorkflowPhaseEnum phase;

    /**
     * 工作项 ID
     */
    private final String workItemId;

    /**
     * 工作项标题
     */
    private final String workItemTitle;

    /**
     * 当前生效的计划（Review 修订后为修订版）
     */
    private WorkflowPlan plan;

    /**
     * 评审轮次，跳过评审时为空列表
     */
    private List<ReviewIteration> reviewIterations;

    /**
     * 探查结果，无探查问题时为空列表
     */
    private List<DiscoveryResult> discoveryResults;

    /**
     * 拆解执行树
     */
    private OverseerPlanEntity dag;

    /**
     * 执行进度
     */
    private ExecutionProgress executionProgress;

    /**
     * 开始时间
     */
    private final LocalDateTime startedAt;

    /**
     * 结束时间
     */
    private LocalDateTime completedAt;

    /**
     * 失败原因
     */
    private String error;

    private WorkflowStateEntity(String workItemId, String workItemTitle) {
        this.workItemId = workItemId;
        this.workItemTitle = workItemTitle;
        this.phase = WorkflowPhaseEnum.PLANNING;
        this.startedAt = LocalDateTime.now();
    }

    /**
     * 以 planning 阶段开始一次运行
     */
    public static WorkflowStateEntity start(String workItemId, String workItemTitle) {
        return new WorkflowStateEntity(workItemId, workItemTitle);
    }

    /**
     * 记录 Plan 阶段产出
     */
    public void recordPlan(WorkflowPlan plan) {
        requirePhase(WorkflowPhaseEnum.PLANNING);
        if (plan == null) {
            throw new IllegalArgumentException("Plan cannot be null");
        }
        this.plan = plan;
    }

    /**
     * planning → reviewing
     */
    public void enterReviewing() {
        requirePhase(WorkflowPhaseEnum.PLANNING);
        if (this.plan == null) {
            throw new IllegalStateException("Plan must be recorded before reviewing");
        }
        this.phase = WorkflowPhaseEnum.REVIEWING;
    }

    /**
     * 记录评审结果；revisedPlan 为空时沿用原计划
     */
    public void recordReview(List<ReviewIteration> iterations, WorkflowPlan revisedPlan) {
        requirePhase(WorkflowPhaseEnum.REVIEWING);
        this.reviewIterations = iterations == null ? new ArrayList<>() : new ArrayList<>(iterations);
        if (revisedPlan != null) {
            this.plan = revisedPlan;
        }
    }

    /**
     * reviewing → discovering
     */
    public void enterDiscovering() {
        requirePhase(WorkflowPhaseEnum.REVIEWING);
        if (this.reviewIterations == null) {
            this.reviewIterations = new ArrayList<>();
        }
        this.phase = WorkflowPhaseEnum.DISCOVERING;
    }

    /**
     * 记录探查结果
     */
    public void recordDiscovery(List<DiscoveryResult> results) {
        requirePhase(WorkflowPhaseEnum.DISCOVERING);
        this.discoveryResults = results == null ? new ArrayList<>() : new ArrayList<>(results);
    }

    /**
     * discovering → decomposing
     */
    public void enterDecomposing() {
        requirePhase(WorkflowPhaseEnum.DISCOVERING);
        if (this.discoveryResults == null) {
            this.discoveryResults = new ArrayList<>();
        }
        this.phase = WorkflowPhaseEnum.DECOMPOSING;
    }

    /**
     * 记录拆解执行树
     */
    public void recordDag(OverseerPlanEntity dag) {
        requirePhase(WorkflowPhaseEnum.DECOMPOSING);
        if (dag == null) {
            throw new IllegalArgumentException("Decomposition tree cannot be null");
        }
        this.dag = dag;
    }

    /**
     * decomposing → executing
     */
    public void enterExecuting() {
        requirePhase(WorkflowPhaseEnum.DECOMPOSING);
        if (this.dag == null) {
            throw new IllegalStateException("Decomposition tree must be recorded before executing");
        }
        this.phase = WorkflowPhaseEnum.EXECUTING;
    }

    /**
     * 记录执行进度快照
     */
    public void recordExecution(ExecutionProgress progress) {
        requirePhase(WorkflowPhaseEnum.EXECUTING);
        this.executionProgress = progress;
    }

    /**
     * executing → completed
     */
    public void complete() {
        requirePhase(WorkflowPhaseEnum.EXECUTING);
        this.phase = WorkflowPhaseEnum.COMPLETED;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * 任意非终态 → failed
     */
    public void fail(String error) {
        if (this.phase.isTerminal()) {
            throw new IllegalStateException("Workflow already finished with phase " + this.phase.getCode());
        }
        this.phase = WorkflowPhaseEnum.FAILED;
        this.error = error == null || error.trim().isEmpty() ? "unknown error" : error;
        this.completedAt = LocalDateTime.now();
    }

    public boolean isFinished() {
        return this.phase.isTerminal();
    }

    public List<ReviewIteration> getReviewIterations() {
        return reviewIterations == null ? null : Collections.unmodifiableList(reviewIterations);
    }

    public List<DiscoveryResult> getDiscoveryResults() {
        return discoveryResults == null ? null : Collections.unmodifiableList(discoveryResults);
    }

    private void requirePhase(WorkflowPhaseEnum expected) {
        if (this.phase != expected) {
            throw new IllegalStateException("Workflow must be in " + expected.getCode()
                    + " phase, current phase is " + this.phase.getCode());
        }
    }
}
