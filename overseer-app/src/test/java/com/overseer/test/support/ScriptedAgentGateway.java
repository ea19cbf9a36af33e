package com.overseer.test.support;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.domain.workflow.adapter.gateway.IReplyReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 可编排的网关替身：按会话 Key 片段配置派发失败、等待结果与最新回复，并记录全部调用。
 * 同时充当回复读取器。
 */
public class ScriptedAgentGateway implements IAgentGateway, IReplyReader {

    public record Call(String method, Map<String, Object> params, long timeoutMs) {

        public String sessionKey() {
            Object value = params == null ? null : params.get("sessionKey");
            return value == null ? null : String.valueOf(value);
        }
    }

    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger runSequence = new AtomicInteger(0);
    private final Map<String, String> sessionByRunId = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> dispatchFailures = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Supplier<Map<String, Object>>> waitResults = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, String> replies = Collections.synchronizedMap(new LinkedHashMap<>());

    public ScriptedAgentGateway failDispatch(String sessionFragment, RuntimeException error) {
        dispatchFailures.put(sessionFragment, error);
        return this;
    }

    public ScriptedAgentGateway waitReturns(String sessionFragment, String status, String error) {
        waitResults.put(sessionFragment, () -> {
            Map<String, Object> result = new HashMap<>();
            result.put("status", status);
            if (error != null) {
                result.put("error", error);
            }
            return result;
        });
        return this;
    }

    public ScriptedAgentGateway waitThrows(String sessionFragment, RuntimeException error) {
        waitResults.put(sessionFragment, () -> {
            throw error;
        });
        return this;
    }

    public ScriptedAgentGateway waitWith(String sessionFragment, Supplier<Map<String, Object>> supplier) {
        waitResults.put(sessionFragment, supplier);
        return this;
    }

    /**
     * 登记一个未经派发的运行，供直接调用等待屏障的用例使用。
     */
    public ScriptedAgentGateway registerRun(String runId, String sessionKey) {
        sessionByRunId.put(runId, sessionKey);
        return this;
    }

    public ScriptedAgentGateway reply(String sessionFragment, String reply) {
        replies.put(sessionFragment, reply);
        return this;
    }

    @Override
    public Map<String, Object> call(String method, Map<String, Object> params, long timeoutMs) {
        Call call = new Call(method, params == null ? new HashMap<>() : new HashMap<>(params), timeoutMs);
        calls.add(call);
        if ("agent".equals(method)) {
            String sessionKey = call.sessionKey();
            RuntimeException failure = match(dispatchFailures, sessionKey);
            if (failure != null) {
                throw failure;
            }
            String runId = "run-" + runSequence.incrementAndGet();
            sessionByRunId.put(runId, sessionKey);
            Map<String, Object> result = new HashMap<>();
            result.put("runId", runId);
            return result;
        }
        if ("agent.wait".equals(method)) {
            String sessionKey = sessionByRunId.get(String.valueOf(call.params().get("runId")));
            Supplier<Map<String, Object>> supplier = match(waitResults, sessionKey);
            if (supplier != null) {
                return supplier.get();
            }
            Map<String, Object> result = new HashMap<>();
            result.put("status", "ok");
            return result;
        }
        throw new IllegalStateException("unexpected gateway method " + method);
    }

    @Override
    public String readLatestReply(String sessionKey) {
        return match(replies, sessionKey);
    }

    public List<Call> calls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    public List<Call> calls(String method) {
        return calls().stream().filter(call -> method.equals(call.method())).collect(Collectors.toList());
    }

    public List<String> dispatchedSessionKeys() {
        return calls("agent").stream().map(Call::sessionKey).collect(Collectors.toList());
    }

    public String sessionOf(String runId) {
        return sessionByRunId.get(runId);
    }

    private <T> T match(Map<String, T> rules, String sessionKey) {
        if (sessionKey == null) {
            return null;
        }
        synchronized (rules) {
            for (Map.Entry<String, T> entry : rules.entrySet()) {
                if (sessionKey.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }
}
