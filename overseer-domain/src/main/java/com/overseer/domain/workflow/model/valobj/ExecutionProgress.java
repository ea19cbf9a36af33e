package com.overseer.domain.workflow.model.valobj;

import lombok.Data;

/**
 * 执行进度。节点计数以 subtask（可执行叶子）为单位。
 */
@Data
public class ExecutionProgress {

    private int totalNodes;

    private int completedNodes;

    private int failedNodes;

    private String currentNodeId;

    public static ExecutionProgress of(int totalNodes) {
        ExecutionProgress progress = new ExecutionProgress();
        progress.setTotalNodes(totalNodes);
        return progress;
    }

    public void startNode(String nodeId) {
        this.currentNodeId = nodeId;
    }

    public void recordDone() {
        this.completedNodes++;
    }

    public void recordFailed() {
        this.failedNodes++;
    }

    public void finish() {
        this.currentNodeId = null;
    }

    public int getPendingNodes() {
        return Math.max(0, totalNodes - completedNodes - failedNodes);
    }
}
