package com.overseer.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 工作流计划 DTO。
 */
@Data
public class WorkflowPlanDTO {

    private String intent;
    private String scope;
    private List<String> discoveryQuestions;
    private List<String> constraints;
    private List<String> successCriteria;
    private String estimatedComplexity;
}
