package com.overseer.infrastructure.log;

import com.overseer.domain.workflow.adapter.gateway.IWorkflowLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * 工作流日志适配到 SLF4J；MDC 中有 workItemId 时作为前缀输出。
 */
@Slf4j
@Component
public class Slf4jWorkflowLogger implements IWorkflowLogger {

    public static final String MDC_WORK_ITEM_ID = "workItemId";

    @Override
    public void info(String message) {
        log.info("{}{}", prefix(), message);
    }

    @Override
    public void warn(String message) {
        log.warn("{}{}", prefix(), message);
    }

    @Override
    public void error(String message) {
        log.error("{}{}", prefix(), message);
    }

    @Override
    public void debug(String message) {
        log.debug("{}{}", prefix(), message);
    }

    private String prefix() {
        String workItemId = MDC.get(MDC_WORK_ITEM_ID);
        return workItemId == null ? "" : "[workflow:" + workItemId + "] ";
    }
}
