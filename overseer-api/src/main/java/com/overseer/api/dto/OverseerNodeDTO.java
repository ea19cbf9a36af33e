package com.overseer.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 执行树节点 DTO，phase/task 通过 children 嵌套。
 */
@Data
public class OverseerNodeDTO {

    private String id;
    /** phase/task/subtask */
    private String level;
    private String name;
    private String status;
    private List<String> acceptanceCriteria;
    private String objective;
    private String runId;
    private String output;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<OverseerNodeDTO> children;
}
