package com.overseer.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作项状态枚举
 *
 * @author getoffer
 * @since 2026-02-03
 */
public enum WorkItemStatusEnum {

    /**
     * 待领取
     */
    PENDING("pending"),

    /**
     * 执行中 - 已被 worker 领取
     */
    IN_PROGRESS("in_progress"),

    /**
     * 阻塞 - 不参与领取
     */
    BLOCKED("blocked"),

    /**
     * 已完成
     */
    COMPLETED("completed"),

    /**
     * 失败
     */
    FAILED("failed"),

    /**
     * 已取消
     */
    CANCELLED("cancelled");

    private final String code;

    WorkItemStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static WorkItemStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkItemStatusEnum status : WorkItemStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown work item status code: " + code);
    }
}
