package com.overseer.domain.workflow.model.valobj;

import lombok.Data;

import java.util.List;

/**
 * 一轮计划评审结果
 */
@Data
public class ReviewIteration {

    /**
     * 轮次，从 1 开始
     */
    private int iteration;

    /**
     * 是否通过
     */
    private boolean approved;

    /**
     * 评审意见
     */
    private String feedback;

    /**
     * 建议修改项（可空）
     */
    private List<String> suggestedChanges;

    /**
     * 部分修订的计划，只有非空字段生效（可空）
     */
    private WorkflowPlan revisedPlan;
}
