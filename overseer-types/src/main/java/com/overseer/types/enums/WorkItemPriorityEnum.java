package com.overseer.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作项优先级，rank 越小越先被领取。
 */
public enum WorkItemPriorityEnum {

    CRITICAL("critical", 0),

    HIGH("high", 1),

    MEDIUM("medium", 2),

    LOW("low", 3);

    private final String code;
    private final int rank;

    WorkItemPriorityEnum(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getRank() {
        return rank;
    }

    public static WorkItemPriorityEnum fromCodeOrDefault(String code, WorkItemPriorityEnum defaultValue) {
        if (code == null || code.trim().isEmpty()) {
            return defaultValue;
        }
        for (WorkItemPriorityEnum priority : WorkItemPriorityEnum.values()) {
            if (priority.code.equalsIgnoreCase(code.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown work item priority code: " + code);
    }
}
