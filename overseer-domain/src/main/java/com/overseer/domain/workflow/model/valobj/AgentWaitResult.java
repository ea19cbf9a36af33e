package com.overseer.domain.workflow.model.valobj;

import com.overseer.types.enums.AgentRunStatusEnum;

/**
 * agent.wait 的返回值。
 */
public record AgentWaitResult(AgentRunStatusEnum status,
                              String error,
                              Long startedAt,
                              Long endedAt) {
}
