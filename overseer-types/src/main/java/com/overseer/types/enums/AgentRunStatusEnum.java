package com.overseer.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 子 Agent 运行结果状态，对应 agent.wait 的返回值。
 */
public enum AgentRunStatusEnum {

    OK("ok"),

    ERROR("error"),

    TIMEOUT("timeout");

    private final String code;

    AgentRunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 宽松解析：未知或缺失的状态一律视为 ERROR。
     */
    public static AgentRunStatusEnum fromCodeOrError(String code) {
        if (code == null) {
            return ERROR;
        }
        for (AgentRunStatusEnum status : AgentRunStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return ERROR;
    }
}
