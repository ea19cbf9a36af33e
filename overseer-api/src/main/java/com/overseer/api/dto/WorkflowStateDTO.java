package com.overseer.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 工作流运行状态 DTO。
 */
@Data
public class WorkflowStateDTO {

    private String phase;
    private String workItemId;
    private String workItemTitle;
    private WorkflowPlanDTO plan;
    private List<ReviewIterationDTO> reviewIterations;
    private List<DiscoveryResultDTO> discoveryResults;
    private Integer planVersion;
    private List<OverseerNodeDTO> dag;
    private ExecutionProgressDTO executionProgress;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String error;
}
