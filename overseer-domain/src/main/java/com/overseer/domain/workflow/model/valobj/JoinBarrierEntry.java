package com.overseer.domain.workflow.model.valobj;

/**
 * 等待屏障的一个条目：一次已派发的子 Agent 运行。
 *
 * @param runId 运行 ID
 * @param sessionKey 子 Agent 会话 Key
 * @param label 展示标签（探查问题原文等）
 */
public record JoinBarrierEntry(String runId, String sessionKey, String label) {
}
