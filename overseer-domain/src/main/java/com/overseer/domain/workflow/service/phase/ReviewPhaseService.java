package com.overseer.domain.workflow.service.phase;

import com.overseer.domain.workflow.model.valobj.ReviewIteration;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Review 阶段：最多 maxIterations 轮评审，遇到首个通过即停止。
 * <p>
 * 每轮的 revisedPlan 只覆盖给出的字段。全部轮次都未通过时沿用最后一次修订的计划继续，并记录告警。
 * </p>
 */
@Service
public class ReviewPhaseService {

    private static final int DEFAULT_MAX_ITERATIONS = 3;

    private final AgentRunDomainService agentRunDomainService;
    private final WorkflowPromptDomainService workflowPromptDomainService;
    private final WorkflowJsonDomainService workflowJsonDomainService;
    private final WorkflowPlanAssembler workflowPlanAssembler;

    public ReviewPhaseService(AgentRunDomainService agentRunDomainService,
                              WorkflowPromptDomainService workflowPromptDomainService,
                              WorkflowJsonDomainService workflowJsonDomainService,
                              WorkflowPlanAssembler workflowPlanAssembler) {
        this.agentRunDomainService = agentRunDomainService;
        this.workflowPromptDomainService = workflowPromptDomainService;
        this.workflowJsonDomainService = workflowJsonDomainService;
        this.workflowPlanAssembler = workflowPlanAssembler;
    }

    public ReviewOutcome run(WorkflowPhaseContext context, WorkflowPlan plan) {
        int maxIterations = resolveMaxIterations(context.config());
        long timeoutMs = context.config().getWorkflow().getPhase().getTimeoutMs();
        List<ReviewIteration> iterations = new ArrayList<>();
        WorkflowPlan current = plan.copy();
        ReviewIteration previous = null;

        for (int i = 1; i <= maxIterations; i++) {
            context.cancellation().throwIfCancelled();
            String sessionKey = WorkflowSessionKeys.review(context.config().getAgentId(), context.workItemId(), i);
            AgentRunRequest request = new AgentRunRequest(sessionKey,
                    workflowPromptDomainService.buildReviewPrompt(context.workItem(), current, i, previous),
                    workflowPromptDomainService.reviewSystemPrompt());
            String reply = agentRunDomainService.runStep(context, request, timeoutMs);

            ReviewIteration iteration = parseIteration(reply, i);
            iterations.add(iteration);
            if (iteration.getRevisedPlan() != null) {
                current = current.merge(iteration.getRevisedPlan());
            }
            context.log().info("Review iteration finished. iteration=" + i
                    + ", approved=" + iteration.isApproved()
                    + ", revised=" + (iteration.getRevisedPlan() != null));
            if (iteration.isApproved()) {
                return new ReviewOutcome(iterations, current, true);
            }
            previous = iteration;
        }

        context.log().warn("Plan not approved after " + maxIterations
                + " review iterations, continuing with the last revised plan");
        return new ReviewOutcome(iterations, current, false);
    }

    private ReviewIteration parseIteration(String reply, int index) {
        Map<String, Object> payload = workflowJsonDomainService.parseEmbeddedJsonObject(reply);
        if (payload == null || payload.isEmpty()) {
            throw new AppException(ResponseCode.AGENT_OUTPUT_INVALID.getCode(),
                    "reviewer reply is not a JSON review (iteration " + index + ")");
        }
        ReviewIteration iteration = new ReviewIteration();
        iteration.setIteration(index);
        Boolean approved = workflowJsonDomainService.getBoolean(payload, "approved", "pass");
        iteration.setApproved(Boolean.TRUE.equals(approved));
        iteration.setFeedback(workflowJsonDomainService.getString(payload, "feedback"));
        iteration.setSuggestedChanges(workflowJsonDomainService.getStringList(payload, "suggestedChanges", "suggested_changes"));
        iteration.setRevisedPlan(workflowPlanAssembler.toRevision(
                workflowJsonDomainService.getMap(payload, "revisedPlan", "revised_plan")));
        return iteration;
    }

    private int resolveMaxIterations(WorkerConfig config) {
        WorkerConfig.Workflow workflow = config.getWorkflow();
        if (workflow == null || workflow.getReview() == null || workflow.getReview().getMaxIterations() <= 0) {
            return DEFAULT_MAX_ITERATIONS;
        }
        return workflow.getReview().getMaxIterations();
    }
}
