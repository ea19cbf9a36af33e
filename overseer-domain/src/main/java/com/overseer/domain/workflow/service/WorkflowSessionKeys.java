package com.overseer.domain.workflow.service;

import com.overseer.types.common.Constants;

/**
 * 子 Agent 会话 Key 规则：由工作项与阶段确定，重跑时可追溯。
 * <p>
 * 形如 {@code agent:<agentId>:workflow:<workItemId>:discover:2}。
 * </p>
 */
public final class WorkflowSessionKeys {

    private WorkflowSessionKeys() {
    }

    public static String plan(String agentId, String workItemId) {
        return base(agentId, workItemId) + Constants.SESSION_KEY_SPLIT + "plan";
    }

    public static String review(String agentId, String workItemId, int iteration) {
        return base(agentId, workItemId) + Constants.SESSION_KEY_SPLIT + "review" + Constants.SESSION_KEY_SPLIT + iteration;
    }

    /**
     * @param index 问题序号，从 1 开始
     */
    public static String discover(String agentId, String workItemId, int index) {
        return base(agentId, workItemId) + Constants.SESSION_KEY_SPLIT + "discover" + Constants.SESSION_KEY_SPLIT + index;
    }

    public static String decompose(String agentId, String workItemId) {
        return base(agentId, workItemId) + Constants.SESSION_KEY_SPLIT + "decompose";
    }

    public static String execute(String agentId, String workItemId, String nodeId) {
        return base(agentId, workItemId) + Constants.SESSION_KEY_SPLIT + "exec" + Constants.SESSION_KEY_SPLIT + nodeId;
    }

    public static String worker(String agentId, String queueId) {
        return "agent" + Constants.SESSION_KEY_SPLIT + normalize(agentId, "main")
                + Constants.SESSION_KEY_SPLIT + "worker" + Constants.SESSION_KEY_SPLIT + normalize(queueId, "default");
    }

    private static String base(String agentId, String workItemId) {
        return "agent" + Constants.SESSION_KEY_SPLIT + normalize(agentId, "main")
                + Constants.SESSION_KEY_SPLIT + "workflow" + Constants.SESSION_KEY_SPLIT + normalize(workItemId, "unknown");
    }

    private static String normalize(String value, String fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        return value.trim().replace(Constants.SESSION_KEY_SPLIT, "-");
    }
}
