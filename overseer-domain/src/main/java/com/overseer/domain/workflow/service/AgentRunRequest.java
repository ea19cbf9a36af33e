package com.overseer.domain.workflow.service;

/**
 * 一次子 Agent 派发请求。
 *
 * @param sessionKey 子 Agent 会话 Key
 * @param message 用户消息
 * @param extraSystemPrompt 附加系统提示（可空）
 */
public record AgentRunRequest(String sessionKey, String message, String extraSystemPrompt) {
}
