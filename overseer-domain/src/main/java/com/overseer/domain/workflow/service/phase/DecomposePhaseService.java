package com.overseer.domain.workflow.service.phase;

import com.overseer.domain.workflow.model.entity.OverseerNode;
import com.overseer.domain.workflow.model.entity.OverseerPhaseNode;
import com.overseer.domain.workflow.model.entity.OverseerPlanEntity;
import com.overseer.domain.workflow.model.entity.OverseerSubtaskNode;
import com.overseer.domain.workflow.model.entity.OverseerTaskNode;
import com.overseer.domain.workflow.model.valobj.DiscoveryResult;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workflow.service.AgentRunDomainService;
import com.overseer.domain.workflow.service.AgentRunRequest;
import com.overseer.domain.workflow.service.WorkflowJsonDomainService;
import com.overseer.domain.workflow.service.WorkflowPhaseContext;
import com.overseer.domain.workflow.service.WorkflowPromptDomainService;
import com.overseer.domain.workflow.service.WorkflowSessionKeys;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decompose 阶段：派发一个拆解子 Agent，把计划转为 phase → task → subtask 执行树。
 * <p>
 * 节点 ID 按层级生成（P1 / P1.T1 / P1.T1.S1），全部节点初始为 todo。
 * 回复无法解析或任一层为空时阶段失败。
 * </p>
 */
@Service
public class DecomposePhaseService {

    private final AgentRunDomainService agentRunDomainService;
    private final WorkflowPromptDomainService workflowPromptDomainService;
    private final WorkflowJsonDomainService workflowJsonDomainService;

    public DecomposePhaseService(AgentRunDomainService agentRunDomainService,
                                 WorkflowPromptDomainService workflowPromptDomainService,
                                 WorkflowJsonDomainService workflowJsonDomainService) {
        this.agentRunDomainService = agentRunDomainService;
        this.workflowPromptDomainService = workflowPromptDomainService;
        this.workflowJsonDomainService = workflowJsonDomainService;
    }

    public OverseerPlanEntity run(WorkflowPhaseContext context,
                                  WorkflowPlan plan,
                                  List<DiscoveryResult> discoveryResults) {
        String sessionKey = WorkflowSessionKeys.decompose(context.config().getAgentId(), context.workItemId());
        AgentRunRequest request = new AgentRunRequest(sessionKey,
                workflowPromptDomainService.buildDecomposePrompt(context.workItem(), plan, discoveryResults),
                workflowPromptDomainService.decomposeSystemPrompt());
        String reply = agentRunDomainService.runStep(context, request,
                context.config().getWorkflow().getPhase().getTimeoutMs());

        Map<String, Object> payload = workflowJsonDomainService.parseEmbeddedJsonObject(reply);
        if (payload == null || payload.isEmpty()) {
            throw new AppException(ResponseCode.AGENT_OUTPUT_INVALID.getCode(),
                    "decomposer reply is not a JSON tree");
        }
        OverseerPlanEntity dag = buildTree(payload);
        try {
            dag.validate();
        } catch (IllegalStateException ex) {
            throw new AppException(ResponseCode.AGENT_OUTPUT_INVALID.getCode(), ex.getMessage(), ex);
        }
        context.log().info("Decomposition ready. phases=" + dag.getPhases().size()
                + ", subtasks=" + dag.countSubtasks());
        return dag;
    }

    /**
     * 按层级构建执行树，不做非空校验。
     */
    public OverseerPlanEntity buildTree(Map<String, Object> payload) {
        OverseerPlanEntity dag = new OverseerPlanEntity();
        int phaseIndex = 0;
        for (Map<String, Object> phaseMap : workflowJsonDomainService.getMapList(payload, "phases")) {
            phaseIndex++;
            OverseerPhaseNode phase = new OverseerPhaseNode();
            fillNode(phase, "P" + phaseIndex, phaseMap, "Phase " + phaseIndex);
            int taskIndex = 0;
            for (Map<String, Object> taskMap : workflowJsonDomainService.getMapList(phaseMap, "tasks")) {
                taskIndex++;
                OverseerTaskNode task = new OverseerTaskNode();
                fillNode(task, phase.getId() + ".T" + taskIndex, taskMap, "Task " + taskIndex);
                int subtaskIndex = 0;
                for (Map<String, Object> subtaskMap : workflowJsonDomainService.getMapList(taskMap, "subtasks")) {
                    subtaskIndex++;
                    OverseerSubtaskNode subtask = new OverseerSubtaskNode();
                    fillNode(subtask, task.getId() + ".S" + subtaskIndex, subtaskMap, "Subtask " + subtaskIndex);
                    String objective = workflowJsonDomainService.getString(subtaskMap, "objective", "description");
                    subtask.setObjective(objective == null ? subtask.getName() : objective);
                    task.getSubtasks().add(subtask);
                }
                phase.getTasks().add(task);
            }
            dag.addPhase(phase);
        }
        return dag;
    }

    private void fillNode(OverseerNode node, String id, Map<String, Object> source, String defaultName) {
        node.setId(id);
        String name = workflowJsonDomainService.getString(source, "name", "title");
        node.setName(name == null ? defaultName : name);
        List<String> criteria = workflowJsonDomainService.getStringList(source, "acceptanceCriteria", "acceptance_criteria");
        node.setAcceptanceCriteria(criteria == null ? new ArrayList<>() : criteria);
    }
}
