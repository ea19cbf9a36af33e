package com.overseer.types.common;

/**
 * 全局常量定义类。
 *
 * @author getoffer
 * @since 2026-02-03
 */
public class Constants {

    /** 会话 Key 分隔符 */
    public final static String SESSION_KEY_SPLIT = ":";

    /** 子 Agent 派发方法 */
    public final static String METHOD_AGENT = "agent";

    /** 子 Agent 等待方法 */
    public final static String METHOD_AGENT_WAIT = "agent.wait";

    /** 会话历史读取方法 */
    public final static String METHOD_CHAT_HISTORY = "chat.history";

    /** 子 Agent 派发通道 */
    public final static String INTERNAL_CHANNEL = "internal";

    /** 子 Agent 派发 lane，嵌套运行不占用主会话队列 */
    public final static String NESTED_LANE = "nested";

    /** 工作流取消时写入状态的错误信息 */
    public final static String CANCELLED_ERROR = "workflow cancelled";

    /** 工作流开关关闭时写入状态的错误信息 */
    public final static String DISABLED_ERROR = "workflow disabled";

}
