package com.overseer.domain.workflow.model.entity;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 拆解执行树（phase → task → subtask）
 * <p>
 * 由 Decompose 阶段一次性生成，Execute 阶段逐节点推进。
 * 节点状态变更统一经由本实体，每次变更递增 planVersion（乐观锁 / 审计）。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Getter
public class OverseerPlanEntity {

    /**
     * 版本号
     */
    private int planVersion = 1;

    /**
     * 阶段列表
     */
    private final List<OverseerPhaseNode> phases = new ArrayList<>();

    public void addPhase(OverseerPhaseNode phase) {
        if (phase == null) {
            throw new IllegalArgumentException("Phase cannot be null");
        }
        phases.add(phase);
    }

    /**
     * 验证执行树：每一层至少一个节点，且全部节点处于 todo。
     */
    public void validate() {
        if (phases.isEmpty()) {
            throw new IllegalStateException("Decomposition must contain at least one phase");
        }
        for (OverseerPhaseNode phase : phases) {
            if (phase.getTasks() == null || phase.getTasks().isEmpty()) {
                throw new IllegalStateException("Phase has no tasks: " + phase.getId());
            }
            for (OverseerTaskNode task : phase.getTasks()) {
                if (task.getSubtasks() == null || task.getSubtasks().isEmpty()) {
                    throw new IllegalStateException("Task has no subtasks: " + task.getId());
                }
            }
        }
    }

    public void startNode(OverseerNode node) {
        node.start();
        planVersion++;
    }

    public void completeNode(OverseerNode node) {
        node.markDone();
        planVersion++;
    }

    public void failNode(OverseerNode node) {
        node.markFailed();
        planVersion++;
    }

    /**
     * subtask 总数，即执行进度的 totalNodes。
     */
    public int countSubtasks() {
        int count = 0;
        for (OverseerPhaseNode phase : phases) {
            for (OverseerTaskNode task : phase.getTasks()) {
                count += task.getSubtasks().size();
            }
        }
        return count;
    }

    public OverseerNode findNode(String nodeId) {
        if (nodeId == null) {
            return null;
        }
        for (OverseerPhaseNode phase : phases) {
            if (nodeId.equals(phase.getId())) {
                return phase;
            }
            for (OverseerTaskNode task : phase.getTasks()) {
                if (nodeId.equals(task.getId())) {
                    return task;
                }
                for (OverseerSubtaskNode subtask : task.getSubtasks()) {
                    if (nodeId.equals(subtask.getId())) {
                        return subtask;
                    }
                }
            }
        }
        return null;
    }
}
