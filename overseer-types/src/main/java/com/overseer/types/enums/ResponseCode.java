package com.overseer.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 0xxx 为通用响应码，Wxxx 为工作流引擎内部的失败分类。
 * </p>
 *
 * @author getoffer
 * @since 2026-02-03
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 工作流阶段执行失败 */
    WORKFLOW_PHASE_FAILED("W001", "工作流阶段执行失败"),

    /** 网关调用失败 */
    GATEWAY_CALL_FAILED("W002", "网关调用失败"),

    /** 子 Agent 运行失败或超时 */
    AGENT_RUN_FAILED("W003", "Agent 运行失败"),

    /** 子 Agent 输出无法解析 */
    AGENT_OUTPUT_INVALID("W004", "Agent 输出无效"),

    /** 工作流已取消 */
    WORKFLOW_CANCELLED("W005", "工作流已取消");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
