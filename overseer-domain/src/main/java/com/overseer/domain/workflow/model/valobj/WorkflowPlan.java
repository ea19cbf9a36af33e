package com.overseer.domain.workflow.model.valobj;

import com.overseer.types.enums.ComplexityEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作流计划：由 Plan 阶段生成，可被 Review 阶段修订。
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Data
public class WorkflowPlan {

    /**
     * 意图
     */
    private String intent;

    /**
     * 范围
     */
    private String scope;

    /**
     * 探查问题，每个问题派发一个探查子 Agent
     */
    private List<String> discoveryQuestions = new ArrayList<>();

    /**
     * 约束
     */
    private List<String> constraints = new ArrayList<>();

    /**
     * 成功标准
     */
    private List<String> successCriteria = new ArrayList<>();

    /**
     * 预估复杂度
     */
    private ComplexityEnum estimatedComplexity = ComplexityEnum.MEDIUM;

    /**
     * 深拷贝，修订时不改动已记录的计划。
     */
    public WorkflowPlan copy() {
        WorkflowPlan copy = new WorkflowPlan();
        copy.setIntent(intent);
        copy.setScope(scope);
        copy.setDiscoveryQuestions(copyList(discoveryQuestions));
        copy.setConstraints(copyList(constraints));
        copy.setSuccessCriteria(copyList(successCriteria));
        copy.setEstimatedComplexity(estimatedComplexity);
        return copy;
    }

    /**
     * 应用部分修订：revision 中非空字段覆盖当前字段，返回新计划。
     */
    public WorkflowPlan merge(WorkflowPlan revision) {
        WorkflowPlan merged = copy();
        if (revision == null) {
            return merged;
        }
        if (revision.getIntent() != null) {
            merged.setIntent(revision.getIntent());
        }
        if (revision.getScope() != null) {
            merged.setScope(revision.getScope());
        }
        if (revision.getDiscoveryQuestions() != null) {
            merged.setDiscoveryQuestions(copyList(revision.getDiscoveryQuestions()));
        }
        if (revision.getConstraints() != null) {
            merged.setConstraints(copyList(revision.getConstraints()));
        }
        if (revision.getSuccessCriteria() != null) {
            merged.setSuccessCriteria(copyList(revision.getSuccessCriteria()));
        }
        if (revision.getEstimatedComplexity() != null) {
            merged.setEstimatedComplexity(revision.getEstimatedComplexity());
        }
        return merged;
    }

    public boolean hasDiscoveryQuestions() {
        return discoveryQuestions != null && !discoveryQuestions.isEmpty();
    }

    private static List<String> copyList(List<String> source) {
        return source == null ? new ArrayList<>() : new ArrayList<>(source);
    }
}
