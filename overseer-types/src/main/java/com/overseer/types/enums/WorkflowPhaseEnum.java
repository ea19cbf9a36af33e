package com.overseer.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流阶段枚举
 *
 * @author getoffer
 * @since 2026-02-03
 */
public enum WorkflowPhaseEnum {

    /**
     * 规划中 - 生成工作流计划
     */
    PLANNING("planning"),

    /**
     * 评审中 - 评审并修订计划
     */
    REVIEWING("reviewing"),

    /**
     * 探查中 - 并发派发探查子 Agent
     */
    DISCOVERING("discovering"),

    /**
     * 拆解中 - 生成 phase/task/subtask 执行树
     */
    DECOMPOSING("decomposing"),

    /**
     * 执行中 - 逐个执行子任务
     */
    EXECUTING("executing"),

    /**
     * 已完成
     */
    COMPLETED("completed"),

    /**
     * 失败 - 任一阶段抛出异常
     */
    FAILED("failed");

    private final String code;

    WorkflowPhaseEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static WorkflowPhaseEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowPhaseEnum phase : WorkflowPhaseEnum.values()) {
            if (phase.code.equals(code)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown workflow phase code: " + code);
    }
}
