package com.overseer.domain.workflow.service;

import com.overseer.domain.workflow.model.entity.OverseerPhaseNode;
import com.overseer.domain.workflow.model.entity.OverseerSubtaskNode;
import com.overseer.domain.workflow.model.entity.OverseerTaskNode;
import com.overseer.domain.workflow.model.valobj.DiscoveryResult;
import com.overseer.domain.workflow.model.valobj.ReviewIteration;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 工作流提示词领域服务：负责 plan/review/discover/decompose/execute 各阶段的子 Agent 指令。
 */
@Service
public class WorkflowPromptDomainService {

    private static final String PLAN_SYSTEM_PROMPT = "你是规划员，只做分析，不修改任何文件。"
            + "仅输出 JSON：{\"intent\": \"...\", \"scope\": \"...\", \"discoveryQuestions\": [\"...\"], "
            + "\"constraints\": [\"...\"], \"successCriteria\": [\"...\"], "
            + "\"estimatedComplexity\": \"low|medium|high\"}。";

    private static final String REVIEW_SYSTEM_PROMPT = "你是计划评审员，不需要生成内容。"
            + "仅输出 JSON：{\"approved\": true/false, \"feedback\": \"...\", \"suggestedChanges\": [\"...\"], "
            + "\"revisedPlan\": {只包含需要修改的字段}}。";

    private static final String DISCOVER_SYSTEM_PROMPT = "你是探查员，只读取和检索，不修改任何文件。"
            + "完成后输出 JSON：{\"findings\": \"...\", \"keyInsights\": [\"...\"]}，"
            + "或在正文后附 \"Key insights\" 小节逐条列出要点。";

    private static final String DECOMPOSE_SYSTEM_PROMPT = "你是任务拆解员，不执行任务。"
            + "仅输出 JSON：{\"phases\": [{\"name\": \"...\", \"acceptanceCriteria\": [\"...\"], "
            + "\"tasks\": [{\"name\": \"...\", \"acceptanceCriteria\": [\"...\"], "
            + "\"subtasks\": [{\"name\": \"...\", \"objective\": \"...\", \"acceptanceCriteria\": [\"...\"]}]}]}]}。"
            + "每个 phase 至少一个 task，每个 task 至少一个 subtask。";

    private static final String EXECUTE_SYSTEM_PROMPT = "你是执行员，只完成当前子任务，不要处理其它子任务。"
            + "完成后简要说明做了什么以及如何满足验收标准。";

    private final WorkflowJsonDomainService workflowJsonDomainService;

    public WorkflowPromptDomainService(WorkflowJsonDomainService workflowJsonDomainService) {
        this.workflowJsonDomainService = workflowJsonDomainService;
    }

    public String planSystemPrompt() {
        return PLAN_SYSTEM_PROMPT;
    }

    public String reviewSystemPrompt() {
        return REVIEW_SYSTEM_PROMPT;
    }

    public String discoverSystemPrompt() {
        return DISCOVER_SYSTEM_PROMPT;
    }

    public String decomposeSystemPrompt() {
        return DECOMPOSE_SYSTEM_PROMPT;
    }

    public String executeSystemPrompt() {
        return EXECUTE_SYSTEM_PROMPT;
    }

    public String buildPlanPrompt(WorkItemEntity workItem) {
        StringBuilder builder = new StringBuilder();
        builder.append("请为以下工作项制定计划。");
        appendWorkItem(builder, workItem);
        return builder.toString();
    }

    public String buildReviewPrompt(WorkItemEntity workItem,
                                    WorkflowPlan plan,
                                    int iteration,
                                    ReviewIteration previous) {
        StringBuilder builder = new StringBuilder();
        builder.append("请评审以下计划（第 ").append(iteration).append(" 轮）。");
        appendWorkItem(builder, workItem);
        builder.append("\n当前计划：").append(workflowJsonDomainService.toJson(plan));
        if (previous != null && !isBlank(previous.getFeedback())) {
            builder.append("\n上一轮意见：").append(previous.getFeedback());
        }
        return builder.toString();
    }

    public String buildDiscoverPrompt(WorkItemEntity workItem, WorkflowPlan plan, String question) {
        StringBuilder builder = new StringBuilder();
        builder.append("探查问题：").append(safeText(question));
        builder.append("\n工作项：").append(safeText(workItem == null ? null : workItem.getTitle()));
        builder.append("\n意图：").append(safeText(plan == null ? null : plan.getIntent()));
        if (plan != null && !isBlank(plan.getScope())) {
            builder.append("\n范围：").append(plan.getScope());
        }
        return builder.toString();
    }

    public String buildDecomposePrompt(WorkItemEntity workItem,
                                       WorkflowPlan plan,
                                       List<DiscoveryResult> discoveryResults) {
        StringBuilder builder = new StringBuilder();
        builder.append("请将以下计划拆解为 phase → task → subtask。");
        appendWorkItem(builder, workItem);
        builder.append("\n计划：").append(workflowJsonDomainService.toJson(plan));
        if (discoveryResults != null && !discoveryResults.isEmpty()) {
            builder.append("\n探查结果：");
            for (DiscoveryResult result : discoveryResults) {
                builder.append("\n- 问题：").append(safeText(result.getQuestion()));
                if (result.isAnswered()) {
                    builder.append("\n  发现：").append(safeText(result.getFindings()));
                    if (result.getKeyInsights() != null && !result.getKeyInsights().isEmpty()) {
                        builder.append("\n  要点：").append(String.join("；", result.getKeyInsights()));
                    }
                } else {
                    builder.append("\n  未获得答案（").append(result.getStatus() == null ? "error" : result.getStatus().getCode())
                            .append("）");
                }
            }
        }
        return builder.toString();
    }

    public String buildExecutePrompt(WorkItemEntity workItem,
                                     WorkflowPlan plan,
                                     OverseerPhaseNode phase,
                                     OverseerTaskNode task,
                                     OverseerSubtaskNode subtask) {
        StringBuilder builder = new StringBuilder();
        builder.append("子任务：").append(safeText(subtask.getName())).append("（").append(subtask.getId()).append("）");
        builder.append("\n目标：").append(safeText(subtask.getObjective()));
        appendCriteria(builder, "验收标准", subtask.getAcceptanceCriteria());
        builder.append("\n所属任务：").append(safeText(task.getName()));
        appendCriteria(builder, "任务验收标准", task.getAcceptanceCriteria());
        builder.append("\n所属阶段：").append(safeText(phase.getName()));
        builder.append("\n工作项：").append(safeText(workItem == null ? null : workItem.getTitle()));
        builder.append("\n意图：").append(safeText(plan == null ? null : plan.getIntent()));
        if (plan != null && plan.getConstraints() != null && !plan.getConstraints().isEmpty()) {
            appendCriteria(builder, "约束", plan.getConstraints());
        }
        return builder.toString();
    }

    private void appendWorkItem(StringBuilder builder, WorkItemEntity workItem) {
        builder.append("\n标题：").append(safeText(workItem == null ? null : workItem.getTitle()));
        if (workItem != null && !isBlank(workItem.getDescription())) {
            builder.append("\n描述：").append(workItem.getDescription());
        }
        if (workItem != null && !isBlank(workItem.getWorkstream())) {
            builder.append("\n工作流：").append(workItem.getWorkstream());
        }
    }

    private void appendCriteria(StringBuilder builder, String title, List<String> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return;
        }
        builder.append("\n").append(title).append("：");
        for (String item : criteria) {
            builder.append("\n- ").append(item);
        }
    }

    private String safeText(String value) {
        return isBlank(value) ? "" : value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
