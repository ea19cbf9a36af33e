package com.overseer.trigger.application.common;

import com.overseer.api.dto.DiscoveryResultDTO;
import com.overseer.api.dto.ExecutionProgressDTO;
import com.overseer.api.dto.OverseerNodeDTO;
import com.overseer.api.dto.ReviewIterationDTO;
import com.overseer.api.dto.WorkItemDTO;
import com.overseer.api.dto.WorkflowPlanDTO;
import com.overseer.api.dto.WorkflowStateDTO;
import com.overseer.domain.workflow.model.entity.OverseerNode;
import com.overseer.domain.workflow.model.entity.OverseerPhaseNode;
import com.overseer.domain.workflow.model.entity.OverseerSubtaskNode;
import com.overseer.domain.workflow.model.entity.OverseerTaskNode;
import com.overseer.domain.workflow.model.entity.WorkflowStateEntity;
import com.overseer.domain.workflow.model.valobj.DiscoveryResult;
import com.overseer.domain.workflow.model.valobj.ExecutionProgress;
import com.overseer.domain.workflow.model.valobj.ReviewIteration;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作项与工作流状态视图组装器。
 */
@Component
public class WorkflowViewAssembler {

    public WorkItemDTO toWorkItemDTO(WorkItemEntity item) {
        if (item == null) {
            return null;
        }
        WorkItemDTO dto = new WorkItemDTO();
        dto.setId(item.getId());
        dto.setQueueId(item.getQueueId());
        dto.setTitle(item.getTitle());
        dto.setDescription(item.getDescription());
        dto.setStatus(item.getStatus() == null ? null : item.getStatus().getCode());
        dto.setStatusReason(item.getStatusReason());
        dto.setPriority(item.getPriority() == null ? null : item.getPriority().getCode());
        dto.setWorkstream(item.getWorkstream());
        dto.setAssignedSessionKey(item.getAssignedSessionKey());
        dto.setStartedAt(item.getStartedAt());
        dto.setCompletedAt(item.getCompletedAt());
        dto.setCreatedAt(item.getCreatedAt());
        dto.setUpdatedAt(item.getUpdatedAt());
        return dto;
    }

    public WorkflowStateDTO toWorkflowStateDTO(WorkflowStateEntity state) {
        if (state == null) {
            return null;
        }
        WorkflowStateDTO dto = new WorkflowStateDTO();
        dto.setPhase(state.getPhase().getCode());
        dto.setWorkItemId(state.getWorkItemId());
        dto.setWorkItemTitle(state.getWorkItemTitle());
        dto.setPlan(toPlanDTO(state.getPlan()));
        if (state.getReviewIterations() != null) {
            dto.setReviewIterations(state.getReviewIterations().stream().map(this::toReviewDTO).collect(Collectors.toList()));
        }
        if (state.getDiscoveryResults() != null) {
            dto.setDiscoveryResults(state.getDiscoveryResults().stream().map(this::toDiscoveryDTO).collect(Collectors.toList()));
        }
        if (state.getDag() != null) {
            dto.setPlanVersion(state.getDag().getPlanVersion());
            List<OverseerNodeDTO> phases = new ArrayList<>();
            for (OverseerPhaseNode phase : state.getDag().getPhases()) {
                OverseerNodeDTO phaseDTO = toNodeDTO(phase, "phase");
                for (OverseerTaskNode task : phase.getTasks()) {
                    OverseerNodeDTO taskDTO = toNodeDTO(task, "task");
                    for (OverseerSubtaskNode subtask : task.getSubtasks()) {
                        OverseerNodeDTO subtaskDTO = toNodeDTO(subtask, "subtask");
                        subtaskDTO.setObjective(subtask.getObjective());
                        subtaskDTO.setRunId(subtask.getRunId());
                        subtaskDTO.setOutput(subtask.getOutput());
                        taskDTO.getChildren().add(subtaskDTO);
                    }
                    phaseDTO.getChildren().add(taskDTO);
                }
                phases.add(phaseDTO);
            }
            dto.setDag(phases);
        }
        dto.setExecutionProgress(toProgressDTO(state.getExecutionProgress()));
        dto.setStartedAt(state.getStartedAt());
        dto.setCompletedAt(state.getCompletedAt());
        dto.setError(state.getError());
        return dto;
    }

    private WorkflowPlanDTO toPlanDTO(WorkflowPlan plan) {
        if (plan == null) {
            return null;
        }
        WorkflowPlanDTO dto = new WorkflowPlanDTO();
        dto.setIntent(plan.getIntent());
        dto.setScope(plan.getScope());
        dto.setDiscoveryQuestions(plan.getDiscoveryQuestions());
        dto.setConstraints(plan.getConstraints());
        dto.setSuccessCriteria(plan.getSuccessCriteria());
        dto.setEstimatedComplexity(plan.getEstimatedComplexity() == null ? null : plan.getEstimatedComplexity().getCode());
        return dto;
    }

    private ReviewIterationDTO toReviewDTO(ReviewIteration iteration) {
        ReviewIterationDTO dto = new ReviewIterationDTO();
        dto.setIteration(iteration.getIteration());
        dto.setApproved(iteration.isApproved());
        dto.setFeedback(iteration.getFeedback());
        dto.setSuggestedChanges(iteration.getSuggestedChanges());
        dto.setRevisedPlan(toPlanDTO(iteration.getRevisedPlan()));
        return dto;
    }

    private DiscoveryResultDTO toDiscoveryDTO(DiscoveryResult result) {
        DiscoveryResultDTO dto = new DiscoveryResultDTO();
        dto.setQuestion(result.getQuestion());
        dto.setRunId(result.getRunId());
        dto.setSessionKey(result.getSessionKey());
        dto.setStatus(result.getStatus() == null ? null : result.getStatus().getCode());
        dto.setFindings(result.getFindings());
        dto.setKeyInsights(result.getKeyInsights());
        dto.setError(result.getError());
        return dto;
    }

    private OverseerNodeDTO toNodeDTO(OverseerNode node, String level) {
        OverseerNodeDTO dto = new OverseerNodeDTO();
        dto.setId(node.getId());
        dto.setLevel(level);
        dto.setName(node.getName());
        dto.setStatus(node.getStatus() == null ? null : node.getStatus().getCode());
        dto.setAcceptanceCriteria(node.getAcceptanceCriteria());
        dto.setCreatedAt(node.getCreatedAt());
        dto.setUpdatedAt(node.getUpdatedAt());
        dto.setChildren(new ArrayList<>());
        return dto;
    }

    private ExecutionProgressDTO toProgressDTO(ExecutionProgress progress) {
        if (progress == null) {
            return null;
        }
        ExecutionProgressDTO dto = new ExecutionProgressDTO();
        dto.setTotalNodes(progress.getTotalNodes());
        dto.setCompletedNodes(progress.getCompletedNodes());
        dto.setFailedNodes(progress.getFailedNodes());
        dto.setCurrentNodeId(progress.getCurrentNodeId());
        return dto;
    }
}
