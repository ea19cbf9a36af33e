package com.overseer.domain.workflow.service;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.domain.workflow.adapter.gateway.IReplyReader;
import com.overseer.domain.workflow.adapter.gateway.IWorkflowLogger;
import com.overseer.domain.workflow.model.valobj.AgentWaitResult;
import com.overseer.domain.workflow.model.valobj.JoinBarrierEntry;
import com.overseer.domain.workflow.model.valobj.JoinBarrierResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 等待屏障领域服务：并发等待一组已派发的子 Agent 运行，按输入顺序返回结果。
 * <p>
 * 约束：
 * <ul>
 *   <li>空输入直接返回空列表，不调用网关</li>
 *   <li>先为全部条目创建 future，再逐个 join</li>
 *   <li>单个条目的任何失败都转换为 error 结果，不影响其它条目，屏障本身不抛异常</li>
 *   <li>超时只由远端 agent.wait 负责，屏障不设本地计时器</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Service
public class JoinBarrierDomainService {

    private final Executor joinBarrierExecutor;
    private final AgentRunDomainService agentRunDomainService;

    public JoinBarrierDomainService(@Qualifier("joinBarrierExecutor") Executor joinBarrierExecutor,
                                    AgentRunDomainService agentRunDomainService) {
        this.joinBarrierExecutor = joinBarrierExecutor;
        this.agentRunDomainService = agentRunDomainService;
    }

    public List<JoinBarrierResult> awaitJoinBarrier(List<JoinBarrierEntry> entries,
                                                    long timeoutMs,
                                                    IAgentGateway gateway,
                                                    IReplyReader replyReader,
                                                    IWorkflowLogger log) {
        if (entries == null || entries.isEmpty()) {
            return new ArrayList<>();
        }

        List<CompletableFuture<JoinBarrierResult>> futures = new ArrayList<>(entries.size());
        for (JoinBarrierEntry entry : entries) {
            futures.add(submit(entry, timeoutMs, gateway, replyReader, log));
        }
        log.debug("Join barrier dispatched. entries=" + entries.size() + ", timeoutMs=" + timeoutMs);

        List<JoinBarrierResult> results = new ArrayList<>(entries.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(joinQuietly(entries.get(i), futures.get(i)));
        }
        return results;
    }

    private CompletableFuture<JoinBarrierResult> submit(JoinBarrierEntry entry,
                                                        long timeoutMs,
                                                        IAgentGateway gateway,
                                                        IReplyReader replyReader,
                                                        IWorkflowLogger log) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> awaitEntry(entry, timeoutMs, gateway, replyReader, log), joinBarrierExecutor)
                    .exceptionally(ex -> JoinBarrierResult.error(entry, resolveMessage(ex)));
        } catch (RejectedExecutionException ex) {
            log.warn("Join barrier entry rejected by executor. runId=" + entry.runId() + ", error=" + ex.getMessage());
            return CompletableFuture.completedFuture(JoinBarrierResult.error(entry, resolveMessage(ex)));
        }
    }

    private JoinBarrierResult awaitEntry(JoinBarrierEntry entry,
                                         long timeoutMs,
                                         IAgentGateway gateway,
                                         IReplyReader replyReader,
                                         IWorkflowLogger log) {
        AgentWaitResult wait;
        try {
            wait = agentRunDomainService.waitForRun(gateway, entry.runId(), timeoutMs);
        } catch (Exception ex) {
            log.warn("Join barrier wait failed. runId=" + entry.runId()
                    + ", sessionKey=" + entry.sessionKey() + ", error=" + ex.getMessage());
            return JoinBarrierResult.error(entry, resolveMessage(ex));
        }

        switch (wait.status()) {
            case TIMEOUT:
                log.warn("Join barrier entry timed out. runId=" + entry.runId() + ", label=" + entry.label());
                return JoinBarrierResult.timeout(entry);
            case ERROR:
                log.warn("Join barrier entry failed. runId=" + entry.runId() + ", error=" + wait.error());
                return JoinBarrierResult.error(entry, wait.error());
            default:
                break;
        }

        try {
            return JoinBarrierResult.ok(entry, replyReader.readLatestReply(entry.sessionKey()));
        } catch (Exception ex) {
            log.warn("Join barrier reply read failed. sessionKey=" + entry.sessionKey() + ", error=" + ex.getMessage());
            return JoinBarrierResult.error(entry, resolveMessage(ex));
        }
    }

    private JoinBarrierResult joinQuietly(JoinBarrierEntry entry, CompletableFuture<JoinBarrierResult> future) {
        try {
            JoinBarrierResult result = future.get();
            return result == null ? JoinBarrierResult.error(entry, "join barrier returned no result") : result;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return JoinBarrierResult.error(entry, "join barrier interrupted");
        } catch (ExecutionException ex) {
            return JoinBarrierResult.error(entry, resolveMessage(ex));
        }
    }

    private String resolveMessage(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null || message.trim().isEmpty() ? cause.getClass().getSimpleName() : message;
    }
}
