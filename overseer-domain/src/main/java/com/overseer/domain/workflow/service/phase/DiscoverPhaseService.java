package com.overseer.domain.workflow.service.phase;

import com.overseer.domain.workflow.model.valobj.DiscoveryResult;
import com.overseer.domain.workflow.model.valobj.JoinBarrierEntry;
import com.overseer.domain.workflow.model.valobj.JoinBarrierResult;
import com.overseer.domain.workflow.model.valobj.SubagentReport;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workflow.service.AgentRunDomainService;
import com.overseer.domain.workflow.service.AgentRunRequest;
import com.overseer.domain.workflow.service.JoinBarrierDomainService;
import com.overseer.domain.workflow.service.SubagentReportDomainService;
import com.overseer.domain.workflow.service.WorkflowPhaseContext;
import com.overseer.domain.workflow.service.WorkflowPromptDomainService;
import com.overseer.domain.workflow.service.WorkflowSessionKeys;
import com.overseer.types.enums.AgentRunStatusEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Discover 阶段：每个探查问题派发一个独立子 Agent，经等待屏障一次性汇合。
 * <p>
 * 单个问题的派发失败、超时或错误只体现在对应的 {@link DiscoveryResult#getStatus()}，不使工作流失败。
 * 结果顺序与 discoveryQuestions 一致。
 * </p>
 */
@Service
public class DiscoverPhaseService {

    private final AgentRunDomainService agentRunDomainService;
    private final JoinBarrierDomainService joinBarrierDomainService;
    private final SubagentReportDomainService subagentReportDomainService;
    private final WorkflowPromptDomainService workflowPromptDomainService;

    public DiscoverPhaseService(AgentRunDomainService agentRunDomainService,
                                JoinBarrierDomainService joinBarrierDomainService,
                                SubagentReportDomainService subagentReportDomainService,
                                WorkflowPromptDomainService workflowPromptDomainService) {
        this.agentRunDomainService = agentRunDomainService;
        this.joinBarrierDomainService = joinBarrierDomainService;
        this.subagentReportDomainService = subagentReportDomainService;
        this.workflowPromptDomainService = workflowPromptDomainService;
    }

    public List<DiscoveryResult> run(WorkflowPhaseContext context, WorkflowPlan plan) {
        List<String> questions = plan.getDiscoveryQuestions();
        if (questions == null || questions.isEmpty()) {
            return new ArrayList<>();
        }
        context.cancellation().throwIfCancelled();

        // 与 questions 一一对应；派发失败的位置直接给出 error 结果
        DiscoveryResult[] results = new DiscoveryResult[questions.size()];
        List<JoinBarrierEntry> entries = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < questions.size(); i++) {
            String question = questions.get(i);
            String sessionKey = WorkflowSessionKeys.discover(context.config().getAgentId(), context.workItemId(), i + 1);
            AgentRunRequest request = new AgentRunRequest(sessionKey,
                    workflowPromptDomainService.buildDiscoverPrompt(context.workItem(), plan, question),
                    workflowPromptDomainService.discoverSystemPrompt());
            try {
                String runId = agentRunDomainService.dispatch(context.gateway(), request);
                entries.add(new JoinBarrierEntry(runId, sessionKey, question));
                positions.add(i);
            } catch (Exception ex) {
                context.log().warn("Discovery dispatch failed. question=" + question + ", error=" + ex.getMessage());
                results[i] = failed(question, null, sessionKey, AgentRunStatusEnum.ERROR, resolveMessage(ex));
            }
        }

        long timeoutMs = context.config().getWorkflow().getDiscovery().getTimeoutMs();
        context.log().info("Discovery dispatched. questions=" + questions.size() + ", dispatched=" + entries.size());
        List<JoinBarrierResult> barrierResults = joinBarrierDomainService.awaitJoinBarrier(entries, timeoutMs,
                context.gateway(), context.replyReader(), context.log());

        for (int i = 0; i < barrierResults.size(); i++) {
            int position = positions.get(i);
            results[position] = toDiscoveryResult(questions.get(position), barrierResults.get(i));
        }

        List<DiscoveryResult> ordered = new ArrayList<>(results.length);
        int answered = 0;
        for (DiscoveryResult result : results) {
            ordered.add(result);
            if (result.isAnswered()) {
                answered++;
            }
        }
        context.log().info("Discovery finished. answered=" + answered + ", total=" + ordered.size());
        return ordered;
    }

    private DiscoveryResult toDiscoveryResult(String question, JoinBarrierResult barrierResult) {
        JoinBarrierEntry entry = barrierResult.entry();
        if (barrierResult.status() != AgentRunStatusEnum.OK) {
            return failed(question, entry.runId(), entry.sessionKey(), barrierResult.status(), barrierResult.error());
        }
        SubagentReport report = subagentReportDomainService.parse(barrierResult.reply());
        DiscoveryResult result = new DiscoveryResult();
        result.setQuestion(question);
        result.setRunId(entry.runId());
        result.setSessionKey(entry.sessionKey());
        result.setStatus(AgentRunStatusEnum.OK);
        result.setFindings(report.findings());
        result.setKeyInsights(new ArrayList<>(report.keyInsights()));
        return result;
    }

    private DiscoveryResult failed(String question, String runId, String sessionKey,
                                   AgentRunStatusEnum status, String error) {
        DiscoveryResult result = new DiscoveryResult();
        result.setQuestion(question);
        result.setRunId(runId);
        result.setSessionKey(sessionKey);
        result.setStatus(status);
        result.setError(error);
        return result;
    }

    private String resolveMessage(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.trim().isEmpty() ? ex.getClass().getSimpleName() : message;
    }
}
