package com.overseer.domain.workflow.service;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.domain.workflow.adapter.gateway.IReplyReader;
import com.overseer.domain.workflow.model.valobj.AgentWaitResult;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.types.common.Constants;
import com.overseer.types.enums.AgentRunStatusEnum;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 子 Agent 运行领域服务：派发（agent）、等待（agent.wait）与单步运行。
 * <p>
 * 网关调用自身抛出的异常原样向上传播，由调用方决定是阶段失败还是节点失败。
 * </p>
 */
@Service
public class AgentRunDomainService {

    private static final long DEFAULT_RPC_GRACE_MS = 10_000L;

    private final WorkerConfig workerConfig;

    public AgentRunDomainService(WorkerConfig workerConfig) {
        this.workerConfig = workerConfig;
    }

    /**
     * 派发子 Agent 运行。
     *
     * @return runId
     */
    public String dispatch(IAgentGateway gateway, AgentRunRequest request) {
        Map<String, Object> params = new HashMap<>();
        params.put("message", request.message());
        params.put("sessionKey", request.sessionKey());
        params.put("idempotencyKey", UUID.randomUUID().toString());
        params.put("deliver", false);
        params.put("channel", Constants.INTERNAL_CHANNEL);
        params.put("lane", Constants.NESTED_LANE);
        if (request.extraSystemPrompt() != null && !request.extraSystemPrompt().trim().isEmpty()) {
            params.put("extraSystemPrompt", request.extraSystemPrompt());
        }
        String thinking = workerConfig == null ? null : workerConfig.getThinking();
        if (thinking != null && !thinking.trim().isEmpty()) {
            params.put("thinking", thinking.trim());
        }

        Map<String, Object> response = gateway.call(Constants.METHOD_AGENT, params, resolveGraceMs());
        Object runId = response == null ? null : response.get("runId");
        if (runId == null || String.valueOf(runId).trim().isEmpty()) {
            throw new AppException(ResponseCode.GATEWAY_CALL_FAILED.getCode(),
                    "agent dispatch returned no runId for session " + request.sessionKey());
        }
        return String.valueOf(runId);
    }

    /**
     * 等待子 Agent 运行结束。超时由远端 agent.wait 负责，RPC 超时在其基础上加宽限。
     */
    public AgentWaitResult waitForRun(IAgentGateway gateway, String runId, long timeoutMs) {
        long waitTimeoutMs = Math.max(timeoutMs, 0L);
        Map<String, Object> params = new HashMap<>();
        params.put("runId", runId);
        params.put("timeoutMs", waitTimeoutMs);
        Map<String, Object> response = gateway.call(Constants.METHOD_AGENT_WAIT, params, waitTimeoutMs + resolveGraceMs());
        return toWaitResult(response);
    }

    /**
     * 单步运行：派发、等待并读取最新回复。运行失败、超时或无回复均抛出 AppException。
     */
    public String runStep(IAgentGateway gateway, IReplyReader replyReader, AgentRunRequest request, long timeoutMs) {
        String runId = dispatch(gateway, request);
        AgentWaitResult wait = waitForRun(gateway, runId, timeoutMs);
        if (wait.status() == AgentRunStatusEnum.TIMEOUT) {
            throw new AppException(ResponseCode.AGENT_RUN_FAILED.getCode(),
                    "agent run timed out after " + timeoutMs + "ms for session " + request.sessionKey());
        }
        if (wait.status() == AgentRunStatusEnum.ERROR) {
            String reason = wait.error() == null ? "unknown error" : wait.error();
            throw new AppException(ResponseCode.AGENT_RUN_FAILED.getCode(),
                    "agent run failed for session " + request.sessionKey() + ": " + reason);
        }
        String reply = replyReader.readLatestReply(request.sessionKey());
        if (reply == null || reply.trim().isEmpty()) {
            throw new AppException(ResponseCode.AGENT_OUTPUT_INVALID.getCode(),
                    "agent returned no reply for session " + request.sessionKey());
        }
        return reply;
    }

    public String runStep(WorkflowPhaseContext context, AgentRunRequest request, long timeoutMs) {
        return runStep(context.gateway(), context.replyReader(), request, timeoutMs);
    }

    private AgentWaitResult toWaitResult(Map<String, Object> response) {
        if (response == null) {
            return new AgentWaitResult(AgentRunStatusEnum.ERROR, "agent.wait returned no payload", null, null);
        }
        Object statusValue = response.get("status");
        AgentRunStatusEnum status = AgentRunStatusEnum.fromCodeOrError(statusValue == null ? null : String.valueOf(statusValue));
        Object errorValue = response.get("error");
        String error = errorValue == null ? null : String.valueOf(errorValue);
        if (status == AgentRunStatusEnum.ERROR && error == null) {
            error = statusValue == null ? "agent.wait returned no status" : "agent run failed";
        }
        return new AgentWaitResult(status, error, toLong(response.get("startedAt")), toLong(response.get("endedAt")));
    }

    private Long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private long resolveGraceMs() {
        if (workerConfig == null || workerConfig.getWorkflow() == null || workerConfig.getWorkflow().getRpcGraceMs() <= 0) {
            return DEFAULT_RPC_GRACE_MS;
        }
        return workerConfig.getWorkflow().getRpcGraceMs();
    }
}
