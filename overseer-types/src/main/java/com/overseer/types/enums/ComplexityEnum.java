package com.overseer.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 计划预估复杂度
 */
public enum ComplexityEnum {

    LOW("low"),

    MEDIUM("medium"),

    HIGH("high");

    private final String code;

    ComplexityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ComplexityEnum fromCodeOrDefault(String code, ComplexityEnum defaultValue) {
        if (code == null) {
            return defaultValue;
        }
        for (ComplexityEnum complexity : ComplexityEnum.values()) {
            if (complexity.code.equalsIgnoreCase(code.trim())) {
                return complexity;
            }
        }
        return defaultValue;
    }
}
