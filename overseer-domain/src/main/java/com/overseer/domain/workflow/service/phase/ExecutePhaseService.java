package com.overseer.domain.workflow.service.phase;

import com.overseer.domain.workflow.model.entity.OverseerNode;
import com.overseer.domain.workflow.model.entity.OverseerPhaseNode;
import com.overseer.domain.workflow.model.entity.OverseerPlanEntity;
import com.overseer.domain.workflow.model.entity.OverseerSubtaskNode;
import com.overseer.domain.workflow.model.entity.OverseerTaskNode;
import com.overseer.domain.workflow.model.valobj.AgentWaitResult;
import com.overseer.domain.workflow.model.valobj.ExecutionProgress;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workflow.service.AgentRunDomainService;
import com.overseer.domain.workflow.service.AgentRunRequest;
import com.overseer.domain.workflow.service.WorkflowPhaseContext;
import com.overseer.domain.workflow.service.WorkflowPromptDomainService;
import com.overseer.domain.workflow.service.WorkflowSessionKeys;
import com.overseer.types.enums.AgentRunStatusEnum;
import com.overseer.types.enums.NodeStatusEnum;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Execute 阶段：顺序深度优先遍历执行树，每个 subtask 派发一个执行子 Agent。
 * <p>
 * 失败传播规则：
 * <ul>
 *   <li>subtask 失败 → 该 task 剩余 subtask 标记为 failed（skipped），所属 task 失败</li>
 *   <li>同一 phase 下的其它 task 继续执行</li>
 *   <li>task 全部 done 时 phase 为 done，否则为 failed</li>
 *   <li>abortOnFailure=true 时首个失败的 subtask 使整个阶段失败</li>
 * </ul>
 * 异常离开本阶段前，仍处于 in_progress 的节点统一标记为 failed。
 * </p>
 */
@Service
public class ExecutePhaseService {

    private final AgentRunDomainService agentRunDomainService;
    private final WorkflowPromptDomainService workflowPromptDomainService;

    public ExecutePhaseService(AgentRunDomainService agentRunDomainService,
                               WorkflowPromptDomainService workflowPromptDomainService) {
        this.agentRunDomainService = agentRunDomainService;
        this.workflowPromptDomainService = workflowPromptDomainService;
    }

    public void run(WorkflowPhaseContext context,
                    WorkflowPlan plan,
                    OverseerPlanEntity dag,
                    ExecutionProgress progress) {
        WorkerConfig.Execute executeConfig = context.config().getWorkflow().getExecute();
        try {
            for (OverseerPhaseNode phase : dag.getPhases()) {
                dag.startNode(phase);
                for (OverseerTaskNode task : phase.getTasks()) {
                    runTask(context, plan, dag, progress, phase, task, executeConfig);
                }
                boolean allDone = phase.getTasks().stream().allMatch(OverseerNode::isDone);
                if (allDone) {
                    dag.completeNode(phase);
                } else {
                    dag.failNode(phase);
                }
                context.log().info("Execution phase finished. nodeId=" + phase.getId()
                        + ", status=" + phase.getStatus().getCode());
            }
        } catch (RuntimeException ex) {
            failOpenNodes(dag);
            throw ex;
        } finally {
            progress.finish();
        }
        context.log().info("Execution finished. total=" + progress.getTotalNodes()
                + ", completed=" + progress.getCompletedNodes()
                + ", failed=" + progress.getFailedNodes()
                + ", planVersion=" + dag.getPlanVersion());
    }

    private void runTask(WorkflowPhaseContext context,
                         WorkflowPlan plan,
                         OverseerPlanEntity dag,
                         ExecutionProgress progress,
                         OverseerPhaseNode phase,
                         OverseerTaskNode task,
                         WorkerConfig.Execute executeConfig) {
        dag.startNode(task);
        List<OverseerSubtaskNode> subtasks = task.getSubtasks();
        for (int i = 0; i < subtasks.size(); i++) {
            OverseerSubtaskNode subtask = subtasks.get(i);
            context.cancellation().throwIfCancelled();
            progress.startNode(subtask.getId());
            dag.startNode(subtask);

            String failure = runSubtask(context, plan, phase, task, subtask, executeConfig.getTimeoutMs());
            if (failure == null) {
                dag.completeNode(subtask);
                progress.recordDone();
                continue;
            }

            dag.failNode(subtask);
            progress.recordFailed();
            context.log().warn("Subtask failed. nodeId=" + subtask.getId() + ", error=" + failure);
            if (executeConfig.isAbortOnFailure()) {
                throw new AppException(ResponseCode.WORKFLOW_PHASE_FAILED.getCode(),
                        "subtask " + subtask.getId() + " failed: " + failure);
            }
            skipRemaining(dag, progress, subtasks.subList(i + 1, subtasks.size()), subtask.getId());
            dag.failNode(task);
            return;
        }
        dag.completeNode(task);
    }

    /**
     * @return 失败原因；成功时返回 null
     */
    private String runSubtask(WorkflowPhaseContext context,
                              WorkflowPlan plan,
                              OverseerPhaseNode phase,
                              OverseerTaskNode task,
                              OverseerSubtaskNode subtask,
                              long timeoutMs) {
        String sessionKey = WorkflowSessionKeys.execute(context.config().getAgentId(), context.workItemId(), subtask.getId());
        AgentRunRequest request = new AgentRunRequest(sessionKey,
                workflowPromptDomainService.buildExecutePrompt(context.workItem(), plan, phase, task, subtask),
                workflowPromptDomainService.executeSystemPrompt());
        try {
            String runId = agentRunDomainService.dispatch(context.gateway(), request);
            subtask.setRunId(runId);
            AgentWaitResult wait = agentRunDomainService.waitForRun(context.gateway(), runId, timeoutMs);
            if (wait.status() == AgentRunStatusEnum.TIMEOUT) {
                return recordFailure(subtask, "subtask timed out after " + timeoutMs + "ms");
            }
            if (wait.status() == AgentRunStatusEnum.ERROR) {
                return recordFailure(subtask, wait.error() == null ? "agent run failed" : wait.error());
            }
            subtask.setOutput(context.replyReader().readLatestReply(sessionKey));
            return null;
        } catch (Exception ex) {
            String message = ex.getMessage();
            return recordFailure(subtask, message == null || message.trim().isEmpty() ? ex.getClass().getSimpleName() : message);
        }
    }

    private void skipRemaining(OverseerPlanEntity dag,
                               ExecutionProgress progress,
                               List<OverseerSubtaskNode> remaining,
                               String failedId) {
        for (OverseerSubtaskNode skipped : remaining) {
            skipped.setOutput("skipped: sibling " + failedId + " failed");
            dag.failNode(skipped);
            progress.recordFailed();
        }
    }

    private String recordFailure(OverseerSubtaskNode subtask, String reason) {
        subtask.setOutput(reason);
        return reason;
    }

    private void failOpenNodes(OverseerPlanEntity dag) {
        for (OverseerPhaseNode phase : dag.getPhases()) {
            for (OverseerTaskNode task : phase.getTasks()) {
                for (OverseerSubtaskNode subtask : task.getSubtasks()) {
                    failIfInProgress(dag, subtask);
                }
                failIfInProgress(dag, task);
            }
            failIfInProgress(dag, phase);
        }
    }

    private void failIfInProgress(OverseerPlanEntity dag, OverseerNode node) {
        if (node.getStatus() == NodeStatusEnum.IN_PROGRESS) {
            dag.failNode(node);
        }
    }
}
