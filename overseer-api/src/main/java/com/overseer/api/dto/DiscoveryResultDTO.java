package com.overseer.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 探查结果 DTO。
 */
@Data
public class DiscoveryResultDTO {

    private String question;
    private String runId;
    private String sessionKey;
    private String status;
    private String findings;
    private List<String> keyInsights;
    private String error;
}
