package com.overseer.domain.workflow.model.valobj;

import com.overseer.types.enums.AgentRunStatusEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个探查问题的结果。status 为 timeout/error 时 findings 为空，
 * 下游仍能看到哪些问题没有答案。
 */
@Data
public class DiscoveryResult {

    private String question;

    private String runId;

    private String sessionKey;

    private AgentRunStatusEnum status;

    private String findings = "";

    private List<String> keyInsights = new ArrayList<>();

    /**
     * 失败原因（仅 error/timeout）
     */
    private String error;

    public boolean isAnswered() {
        return status == AgentRunStatusEnum.OK;
    }
}
