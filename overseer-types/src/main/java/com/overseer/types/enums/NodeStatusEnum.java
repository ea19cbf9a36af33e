package com.overseer.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执行树节点状态枚举（phase / task / subtask 共用）
 *
 * @author getoffer
 * @since 2026-02-03
 */
public enum NodeStatusEnum {

    /**
     * 待执行
     */
    TODO("todo"),

    /**
     * 执行中
     */
    IN_PROGRESS("in_progress"),

    /**
     * 已完成
     */
    DONE("done"),

    /**
     * 失败
     */
    FAILED("failed");

    private final String code;

    NodeStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public static NodeStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (NodeStatusEnum status : NodeStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown node status code: " + code);
    }
}
