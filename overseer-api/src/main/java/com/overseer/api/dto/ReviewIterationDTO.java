package com.overseer.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 计划评审轮次 DTO。
 */
@Data
public class ReviewIterationDTO {

    private int iteration;
    private boolean approved;
    private String feedback;
    private List<String> suggestedChanges;
    private WorkflowPlanDTO revisedPlan;
}
