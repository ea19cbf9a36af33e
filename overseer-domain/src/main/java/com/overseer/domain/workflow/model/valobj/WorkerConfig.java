package com.overseer.domain.workflow.model.valobj;

import lombok.Data;

/**
 * Worker 配置，由应用层绑定自 overseer.worker.*。
 * <p>
 * 阶段跳过规则只读取 {@code workflow.review.enabled}；
 * 是否执行探查由计划内容决定，与配置无关。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Data
public class WorkerConfig {

    /** worker 总开关 */
    private boolean enabled = true;

    /** 子 Agent 所属 agentId，用于拼接会话 Key */
    private String agentId = "main";

    /** 子 Agent 思考级别，透传给 agent 派发（可空） */
    private String thinking;

    /** 领取工作项的队列 ID */
    private String queueId = "default";

    /** 同时运行的工作流上限 */
    private int concurrencyLimit = 2;

    private Workflow workflow = new Workflow();

    @Data
    public static class Workflow {

        /** 工作流开关 */
        private boolean enabled = true;

        /** 网关 RPC 超时相对 agent.wait 超时的宽限（毫秒） */
        private long rpcGraceMs = 10_000L;

        private Review review = new Review();

        private Discovery discovery = new Discovery();

        private Phase phase = new Phase();

        private Execute execute = new Execute();
    }

    @Data
    public static class Review {

        private boolean enabled = true;

        /** 评审最多轮数 */
        private int maxIterations = 3;
    }

    @Data
    public static class Discovery {

        /** 每个探查子 Agent 的等待超时（毫秒） */
        private long timeoutMs = 300_000L;
    }

    @Data
    public static class Phase {

        /** Plan / Review / Decompose 单次子 Agent 等待超时（毫秒） */
        private long timeoutMs = 300_000L;
    }

    @Data
    public static class Execute {

        /** 单个 subtask 的等待超时（毫秒） */
        private long timeoutMs = 600_000L;

        /** 为 true 时首个失败的 subtask 使整个工作流失败 */
        private boolean abortOnFailure = false;
    }

    /**
     * review 配置缺失时视为开启。
     */
    public boolean isReviewEnabled() {
        return workflow == null || workflow.getReview() == null || workflow.getReview().isEnabled();
    }

    public boolean isWorkflowEnabled() {
        return workflow == null || workflow.isEnabled();
    }
}
