package com.overseer.api.dto;

import lombok.Data;

/**
 * 执行进度 DTO。
 */
@Data
public class ExecutionProgressDTO {

    private int totalNodes;
    private int completedNodes;
    private int failedNodes;
    private String currentNodeId;
}
