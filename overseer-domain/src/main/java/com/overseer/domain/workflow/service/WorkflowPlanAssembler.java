package com.overseer.domain.workflow.service;

import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.types.enums.ComplexityEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 将子 Agent 输出的 JSON 组装为 {@link WorkflowPlan}。
 */
@Component
public class WorkflowPlanAssembler {

    private final WorkflowJsonDomainService json;

    public WorkflowPlanAssembler(WorkflowJsonDomainService workflowJsonDomainService) {
        this.json = workflowJsonDomainService;
    }

    /**
     * 完整计划：缺失字段取默认值。
     */
    public WorkflowPlan toPlan(Map<String, Object> payload) {
        Map<String, Object> source = unwrap(payload);
        WorkflowPlan plan = new WorkflowPlan();
        plan.setIntent(json.getString(source, "intent", "goal"));
        plan.setScope(json.getString(source, "scope"));
        plan.setDiscoveryQuestions(orEmpty(json.getStringList(source, "discoveryQuestions", "discovery_questions")));
        plan.setConstraints(orEmpty(json.getStringList(source, "constraints")));
        plan.setSuccessCriteria(orEmpty(json.getStringList(source, "successCriteria", "success_criteria")));
        plan.setEstimatedComplexity(ComplexityEnum.fromCodeOrDefault(
                json.getString(source, "estimatedComplexity", "estimated_complexity", "complexity"),
                ComplexityEnum.MEDIUM));
        return plan;
    }

    /**
     * 部分修订：缺失字段保持为 null，合并时不覆盖。
     */
    public WorkflowPlan toRevision(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        WorkflowPlan revision = new WorkflowPlan();
        revision.setIntent(json.getString(payload, "intent", "goal"));
        revision.setScope(json.getString(payload, "scope"));
        revision.setDiscoveryQuestions(json.getStringList(payload, "discoveryQuestions", "discovery_questions"));
        revision.setConstraints(json.getStringList(payload, "constraints"));
        revision.setSuccessCriteria(json.getStringList(payload, "successCriteria", "success_criteria"));
        String complexity = json.getString(payload, "estimatedComplexity", "estimated_complexity", "complexity");
        revision.setEstimatedComplexity(ComplexityEnum.fromCodeOrDefault(complexity, null));
        return revision;
    }

    private Map<String, Object> unwrap(Map<String, Object> payload) {
        Map<String, Object> nested = json.getMap(payload, "plan", "workflowPlan");
        return nested == null ? payload : nested;
    }

    private List<String> orEmpty(List<String> values) {
        return values == null ? new ArrayList<>() : values;
    }
}
