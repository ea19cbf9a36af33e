package com.overseer.domain.workflow.model.valobj;

import com.overseer.types.enums.AgentRunStatusEnum;

/**
 * 等待屏障条目的结果。reply 仅在 OK 时可能非空，error 仅在 ERROR 时非空。
 */
public record JoinBarrierResult(JoinBarrierEntry entry,
                                AgentRunStatusEnum status,
                                String reply,
                                String error) {

    public static JoinBarrierResult ok(JoinBarrierEntry entry, String reply) {
        return new JoinBarrierResult(entry, AgentRunStatusEnum.OK, reply, null);
    }

    public static JoinBarrierResult timeout(JoinBarrierEntry entry) {
        return new JoinBarrierResult(entry, AgentRunStatusEnum.TIMEOUT, null, null);
    }

    public static JoinBarrierResult error(JoinBarrierEntry entry, String error) {
        return new JoinBarrierResult(entry, AgentRunStatusEnum.ERROR, null, error);
    }
}
