package com.overseer.domain.workflow.service;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.domain.workflow.adapter.gateway.IReplyReader;
import com.overseer.domain.workflow.adapter.gateway.IWorkflowLogger;
import com.overseer.domain.workflow.model.entity.OverseerPlanEntity;
import com.overseer.domain.workflow.model.entity.WorkflowStateEntity;
import com.overseer.domain.workflow.model.valobj.DiscoveryResult;
import com.overseer.domain.workflow.model.valobj.ExecutionProgress;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workflow.model.valobj.WorkflowCancellation;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workflow.service.phase.DecomposePhaseService;
import com.overseer.domain.workflow.service.phase.DiscoverPhaseService;
import com.overseer.domain.workflow.service.phase.ExecutePhaseService;
import com.overseer.domain.workflow.service.phase.PlanPhaseService;
import com.overseer.domain.workflow.service.phase.ReviewOutcome;
import com.overseer.domain.workflow.service.phase.ReviewPhaseService;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.types.common.Constants;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作流引擎：驱动单个工作项依次经过 planning → reviewing → discovering → decomposing → executing → completed。
 * <p>
 * 约束：
 * <ul>
 *   <li>executeWorkflow 不抛异常，任一阶段异常都记录为 failed 状态返回</li>
 *   <li>review.enabled=false 时跳过评审，reviewIterations 为空列表</li>
 *   <li>计划没有探查问题时跳过探查，不发起任何 RPC</li>
 *   <li>每次运行独立创建状态与上下文，运行之间只共享注入的协作者</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Service
public class WorkflowEngine {

    private final WorkerConfig workerConfig;
    private final IAgentGateway agentGateway;
    private final IReplyReader replyReader;
    private final IWorkflowLogger workflowLogger;
    private final PlanPhaseService planPhaseService;
    private final ReviewPhaseService reviewPhaseService;
    private final DiscoverPhaseService discoverPhaseService;
    private final DecomposePhaseService decomposePhaseService;
    private final ExecutePhaseService executePhaseService;

    public WorkflowEngine(WorkerConfig workerConfig,
                          IAgentGateway agentGateway,
                          IReplyReader replyReader,
                          IWorkflowLogger workflowLogger,
                          PlanPhaseService planPhaseService,
                          ReviewPhaseService reviewPhaseService,
                          DiscoverPhaseService discoverPhaseService,
                          DecomposePhaseService decomposePhaseService,
                          ExecutePhaseService executePhaseService) {
        this.workerConfig = workerConfig;
        this.agentGateway = agentGateway;
        this.replyReader = replyReader;
        this.workflowLogger = workflowLogger;
        this.planPhaseService = planPhaseService;
        this.reviewPhaseService = reviewPhaseService;
        this.discoverPhaseService = discoverPhaseService;
        this.decomposePhaseService = decomposePhaseService;
        this.executePhaseService = executePhaseService;
    }

    public WorkflowStateEntity executeWorkflow(WorkItemEntity workItem) {
        return executeWorkflow(workItem, WorkflowCancellation.none());
    }

    public WorkflowStateEntity executeWorkflow(WorkItemEntity workItem, WorkflowCancellation cancellation) {
        WorkflowStateEntity state = WorkflowStateEntity.start(
                workItem == null ? null : workItem.getId(),
                workItem == null ? null : workItem.getTitle());
        if (workItem == null) {
            state.fail("work item cannot be null");
            workflowLogger.error("Workflow rejected: work item is null");
            return state;
        }
        if (!workerConfig.isWorkflowEnabled()) {
            state.fail(Constants.DISABLED_ERROR);
            workflowLogger.warn("Workflow skipped, workflow disabled. workItemId=" + workItem.getId());
            return state;
        }

        WorkflowPhaseContext context = new WorkflowPhaseContext(workItem, workerConfig, agentGateway, replyReader,
                workflowLogger, cancellation == null ? WorkflowCancellation.none() : cancellation);
        try {
            runPhases(context, state);
        } catch (Exception ex) {
            if (state.isFinished()) {
                return state;
            }
            String message = resolveMessage(ex);
            String failedPhase = state.getPhase().getCode();
            state.fail(message);
            workflowLogger.error("Workflow failed. workItemId=" + workItem.getId()
                    + ", phase=" + failedPhase + ", error=" + message);
        }
        return state;
    }

    private void runPhases(WorkflowPhaseContext context, WorkflowStateEntity state) {
        WorkflowCancellation cancellation = context.cancellation();
        workflowLogger.info("Workflow started. workItemId=" + context.workItemId() + ", title=" + state.getWorkItemTitle());

        cancellation.throwIfCancelled();
        WorkflowPlan plan = planPhaseService.run(context);
        state.recordPlan(plan);
        state.enterReviewing();
        logTransition(state);

        cancellation.throwIfCancelled();
        if (workerConfig.isReviewEnabled()) {
            ReviewOutcome outcome = reviewPhaseService.run(context, state.getPlan());
            state.recordReview(outcome.iterations(), outcome.plan());
        } else {
            workflowLogger.info("Review skipped, review disabled. workItemId=" + context.workItemId());
            state.recordReview(new ArrayList<>(), null);
        }
        state.enterDiscovering();
        logTransition(state);

        cancellation.throwIfCancelled();
        List<DiscoveryResult> discoveryResults;
        if (state.getPlan().hasDiscoveryQuestions()) {
            discoveryResults = discoverPhaseService.run(context, state.getPlan());
        } else {
            workflowLogger.info("Discovery skipped, no discovery questions. workItemId=" + context.workItemId());
            discoveryResults = new ArrayList<>();
        }
        state.recordDiscovery(discoveryResults);
        state.enterDecomposing();
        logTransition(state);

        cancellation.throwIfCancelled();
        OverseerPlanEntity dag = decomposePhaseService.run(context, state.getPlan(), state.getDiscoveryResults());
        state.recordDag(dag);
        state.enterExecuting();
        logTransition(state);

        cancellation.throwIfCancelled();
        ExecutionProgress progress = ExecutionProgress.of(dag.countSubtasks());
        state.recordExecution(progress);
        executePhaseService.run(context, state.getPlan(), dag, progress);
        state.complete();
        workflowLogger.info("Workflow completed. workItemId=" + context.workItemId()
                + ", completedNodes=" + progress.getCompletedNodes()
                + ", failedNodes=" + progress.getFailedNodes());
    }

    private void logTransition(WorkflowStateEntity state) {
        workflowLogger.debug("Workflow phase changed. workItemId=" + state.getWorkItemId()
                + ", phase=" + state.getPhase().getCode());
    }

    private String resolveMessage(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.trim().isEmpty() ? ex.getClass().getName() : message;
    }
}
