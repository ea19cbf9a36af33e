package com.overseer.domain.workflow.adapter.gateway;

/**
 * 工作流日志端口，构造时注入引擎；实现须线程安全。
 */
public interface IWorkflowLogger {

    void info(String message);

    void warn(String message);

    void error(String message);

    void debug(String message);
}
