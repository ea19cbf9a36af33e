package com.overseer.domain.workflow.adapter.gateway;

import java.util.Map;

/**
 * Agent 网关 RPC 端口：派发子 Agent 运行、等待运行结束、读取会话历史。
 * <p>
 * 实现必须可并发调用（等待屏障会在多个线程上同时调用）。
 * 调用失败（网络错误、网关返回错误）以异常抛出。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@FunctionalInterface
public interface IAgentGateway {

    /**
     * 调用网关方法。
     *
     * @param method 方法名，如 agent / agent.wait / chat.history
     * @param params 参数
     * @param timeoutMs RPC 超时（毫秒）
     * @return 网关返回的 payload，无 payload 时返回空 Map
     */
    Map<String, Object> call(String method, Map<String, Object> params, long timeoutMs);
}
