package com.overseer.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 工作项 DTO。
 */
@Data
public class WorkItemDTO {

    private String id;
    private String queueId;
    private String title;
    private String description;
    private String status;
    private String statusReason;
    private String priority;
    private String workstream;
    private String assignedSessionKey;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
