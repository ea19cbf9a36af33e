package com.overseer.domain.workflow.service.phase;

import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workflow.service.AgentRunDomainService;
import com.overseer.domain.workflow.service.AgentRunRequest;
import com.overseer.domain.workflow.service.WorkflowJsonDomainService;
import com.overseer.domain.workflow.service.WorkflowPhaseContext;
import com.overseer.domain.workflow.service.WorkflowPlanAssembler;
import com.overseer.domain.workflow.service.WorkflowPromptDomainService;
import com.overseer.domain.workflow.service.WorkflowSessionKeys;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Plan 阶段：派发一个规划子 Agent，解析出 {@link WorkflowPlan}。
 * 回复为空、无法解析或缺少 intent 时阶段失败。
 */
@Service
public class PlanPhaseService {

    private final AgentRunDomainService agentRunDomainService;
    private final WorkflowPromptDomainService workflowPromptDomainService;
    private final WorkflowJsonDomainService workflowJsonDomainService;
    private final WorkflowPlanAssembler workflowPlanAssembler;

    public PlanPhaseService(AgentRunDomainService agentRunDomainService,
                            WorkflowPromptDomainService workflowPromptDomainService,
                            WorkflowJsonDomainService workflowJsonDomainService,
                            WorkflowPlanAssembler workflowPlanAssembler) {
        this.agentRunDomainService = agentRunDomainService;
        this.workflowPromptDomainService = workflowPromptDomainService;
        this.workflowJsonDomainService = workflowJsonDomainService;
        this.workflowPlanAssembler = workflowPlanAssembler;
    }

    public WorkflowPlan run(WorkflowPhaseContext context) {
        String sessionKey = WorkflowSessionKeys.plan(context.config().getAgentId(), context.workItemId());
        AgentRunRequest request = new AgentRunRequest(sessionKey,
                workflowPromptDomainService.buildPlanPrompt(context.workItem()),
                workflowPromptDomainService.planSystemPrompt());
        String reply = agentRunDomainService.runStep(context, request,
                context.config().getWorkflow().getPhase().getTimeoutMs());

        Map<String, Object> payload = workflowJsonDomainService.parseEmbeddedJsonObject(reply);
        if (payload == null || payload.isEmpty()) {
            throw new AppException(ResponseCode.AGENT_OUTPUT_INVALID.getCode(),
                    "planner reply is not a JSON plan");
        }
        WorkflowPlan plan = workflowPlanAssembler.toPlan(payload);
        if (plan.getIntent() == null || plan.getIntent().trim().isEmpty()) {
            throw new AppException(ResponseCode.AGENT_OUTPUT_INVALID.getCode(),
                    "planner reply has no intent");
        }
        context.log().info("Plan ready. intent=" + plan.getIntent()
                + ", discoveryQuestions=" + plan.getDiscoveryQuestions().size()
                + ", complexity=" + plan.getEstimatedComplexity().getCode());
        return plan;
    }
}
