package com.overseer.domain.workflow.service;

import com.overseer.domain.workflow.model.valobj.SubagentReport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 子 Agent 结构化报告解析。
 * <p>
 * 优先读取回复中的 JSON（findings / keyInsights）；
 * 否则整段回复作为 findings，"Key insights" 标题下的列表项作为 keyInsights。
 * </p>
 */
@Service
public class SubagentReportDomainService {

    private static final int MAX_INSIGHTS = 10;

    private final WorkflowJsonDomainService workflowJsonDomainService;

    public SubagentReportDomainService(WorkflowJsonDomainService workflowJsonDomainService) {
        this.workflowJsonDomainService = workflowJsonDomainService;
    }

    public SubagentReport parse(String reply) {
        if (reply == null || reply.trim().isEmpty()) {
            return SubagentReport.empty();
        }
        Map<String, Object> payload = workflowJsonDomainService.parseEmbeddedJsonObject(reply);
        String findings = workflowJsonDomainService.getString(payload, "findings", "summary");
        if (findings != null) {
            List<String> insights = workflowJsonDomainService.getStringList(payload, "keyInsights", "key_insights", "insights");
            return new SubagentReport(findings, limit(insights == null ? new ArrayList<>() : insights));
        }
        String text = reply.trim();
        return new SubagentReport(text, limit(extractInsights(text)));
    }

    private List<String> extractInsights(String text) {
        List<String> insights = new ArrayList<>();
        boolean inSection = false;
        for (String rawLine : text.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (isInsightHeading(line)) {
                inSection = true;
                continue;
            }
            if (!inSection) {
                continue;
            }
            if (line.isEmpty()) {
                if (!insights.isEmpty()) {
                    break;
                }
                continue;
            }
            String item = stripBullet(line);
            if (item == null) {
                break;
            }
            if (!item.isEmpty()) {
                insights.add(item);
            }
        }
        return insights;
    }

    private boolean isInsightHeading(String line) {
        String normalized = line.replaceAll("^[#*\\s]+", "").replaceAll("[*:\\s]+$", "").toLowerCase(Locale.ROOT);
        return "key insights".equals(normalized) || "keyinsights".equals(normalized) || "insights".equals(normalized);
    }

    /**
     * 返回去掉列表符号后的内容；不是列表项时返回 null。
     */
    private String stripBullet(String line) {
        if (line.startsWith("- ") || line.startsWith("* ") || line.startsWith("• ")) {
            return line.substring(2).trim();
        }
        if (line.matches("^\\d+[.)]\\s+.*")) {
            return line.replaceFirst("^\\d+[.)]\\s+", "").trim();
        }
        return null;
    }

    private List<String> limit(List<String> insights) {
        return insights.size() <= MAX_INSIGHTS ? insights : new ArrayList<>(insights.subList(0, MAX_INSIGHTS));
    }
}
