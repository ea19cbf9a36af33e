package com.overseer.domain.workflow.model.valobj;

import java.util.List;

/**
 * 子 Agent 结构化报告解析结果。
 */
public record SubagentReport(String findings, List<String> keyInsights) {

    public static SubagentReport empty() {
        return new SubagentReport("", List.of());
    }
}
