package com.overseer.domain.workflow.service.phase;

import com.overseer.domain.workflow.model.valobj.ReviewIteration;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;

import java.util.List;

/**
 * Review 阶段产出：评审轮次、最终计划以及是否通过。
 */
public record ReviewOutcome(List<ReviewIteration> iterations, WorkflowPlan plan, boolean approved) {
}
