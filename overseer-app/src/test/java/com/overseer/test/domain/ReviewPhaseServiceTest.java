package com.overseer.test.domain;

import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workflow.model.valobj.WorkflowCancellation;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workflow.service.AgentRunDomainService;
import com.overseer.domain.workflow.service.WorkflowJsonDomainService;
import com.overseer.domain.workflow.service.WorkflowPhaseContext;
import com.overseer.domain.workflow.service.WorkflowPlanAssembler;
import com.overseer.domain.workflow.service.WorkflowPromptDomainService;
import com.overseer.domain.workflow.service.phase.ReviewOutcome;
import com.overseer.domain.workflow.service.phase.ReviewPhaseService;
import com.overseer.test.support.RecordingWorkflowLogger;
import com.overseer.test.support.ScriptedAgentGateway;
import com.overseer.test.support.WorkflowTestHarness;
import com.overseer.types.enums.ComplexityEnum;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class ReviewPhaseServiceTest {

    private ScriptedAgentGateway gateway;
    private RecordingWorkflowLogger logger;
    private WorkerConfig config;
    private ReviewPhaseService reviewPhaseService;

    @BeforeEach
    public void setUp() {
        gateway = new ScriptedAgentGateway();
        logger = new RecordingWorkflowLogger();
        config = WorkflowTestHarness.defaultConfig();
        WorkflowJsonDomainService json = WorkflowTestHarness.jsonService();
        reviewPhaseService = new ReviewPhaseService(new AgentRunDomainService(config),
                new WorkflowPromptDomainService(json), json, new WorkflowPlanAssembler(json));
    }

    @Test
    public void shouldStopAtFirstApproval() {
        gateway.reply(":review:1", "{\"approved\":false,\"feedback\":\"too vague\",\"suggestedChanges\":[\"name the files\"]}")
                .reply(":review:2", "```json\n{\"approved\":true,\"feedback\":\"ok now\"}\n```");

        ReviewOutcome outcome = reviewPhaseService.run(context(), basePlan());

        Assertions.assertTrue(outcome.approved());
        Assertions.assertEquals(2, outcome.iterations().size());
        Assertions.assertEquals(1, outcome.iterations().get(0).getIteration());
        Assertions.assertEquals(List.of("name the files"), outcome.iterations().get(0).getSuggestedChanges());
        Assertions.assertEquals("ok now", outcome.iterations().get(1).getFeedback());
        Assertions.assertEquals(2, gateway.calls("agent").size());
    }

    @Test
    public void shouldNeverExceedMaxIterations() {
        config.getWorkflow().getReview().setMaxIterations(2);
        gateway.reply(":review:", "{\"approved\":false,\"feedback\":\"still not good\"}");

        ReviewOutcome outcome = reviewPhaseService.run(context(), basePlan());

        Assertions.assertFalse(outcome.approved());
        Assertions.assertEquals(2, outcome.iterations().size());
        Assertions.assertEquals(2, gateway.calls("agent").size());
        Assertions.assertTrue(logger.contains("WARN", "Plan not approved after 2 review iterations"));
    }

    @Test
    public void shouldUseDefaultBoundWhenMaxIterationsNotPositive() {
        config.getWorkflow().getReview().setMaxIterations(0);
        gateway.reply(":review:", "{\"approved\":false}");

        ReviewOutcome outcome = reviewPhaseService.run(context(), basePlan());

        Assertions.assertEquals(3, outcome.iterations().size());
    }

    @Test
    public void shouldMergeOnlyRevisedFields() {
        gateway.reply(":review:1", "{\"approved\":false,\"revisedPlan\":{\"scope\":\"backend only\",\"estimatedComplexity\":\"high\"}}")
                .reply(":review:2", "{\"approved\":true,\"revisedPlan\":{\"constraints\":[\"keep API stable\"]}}");
        WorkflowPlan original = basePlan();

        ReviewOutcome outcome = reviewPhaseService.run(context(), original);

        WorkflowPlan revised = outcome.plan();
        Assertions.assertEquals("Add login", revised.getIntent());
        Assertions.assertEquals("backend only", revised.getScope());
        Assertions.assertEquals(ComplexityEnum.HIGH, revised.getEstimatedComplexity());
        Assertions.assertEquals(List.of("keep API stable"), revised.getConstraints());
        Assertions.assertEquals(List.of("Where is auth?"), revised.getDiscoveryQuestions());
        // 原计划不被修改
        Assertions.assertEquals("web", original.getScope());
        Assertions.assertEquals(ComplexityEnum.LOW, original.getEstimatedComplexity());
    }

    @Test
    public void shouldFailOnUnparsableReview() {
        gateway.reply(":review:1", "Looks fine to me");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> reviewPhaseService.run(context(), basePlan()));
        Assertions.assertEquals(ResponseCode.AGENT_OUTPUT_INVALID.getCode(), ex.getCode());
    }

    private WorkflowPhaseContext context() {
        return new WorkflowPhaseContext(WorkflowTestHarness.newWorkItem("wi-1", "Add login"), config,
                gateway, gateway, logger, WorkflowCancellation.none());
    }

    private WorkflowPlan basePlan() {
        WorkflowPlan plan = new WorkflowPlan();
        plan.setIntent("Add login");
        plan.setScope("web");
        plan.setDiscoveryQuestions(new ArrayList<>(List.of("Where is auth?")));
        plan.setEstimatedComplexity(ComplexityEnum.LOW);
        return plan;
    }
}
