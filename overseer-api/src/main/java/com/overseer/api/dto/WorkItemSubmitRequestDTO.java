package com.overseer.api.dto;

import lombok.Data;

/**
 * 工作项入队请求 DTO。
 */
@Data
public class WorkItemSubmitRequestDTO {

    /** 队列 ID，为空时使用 worker 默认队列 */
    private String queueId;
    private String title;
    private String description;
    /** critical/high/medium/low，为空时为 medium */
    private String priority;
    private String workstream;
}
