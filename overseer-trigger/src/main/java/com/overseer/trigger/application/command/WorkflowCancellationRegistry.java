package com.overseer.trigger.application.command;

import com.overseer.domain.workflow.model.valobj.WorkflowCancellation;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 运行中工作流的取消句柄登记表，key 为工作项 ID。
 */
@Component
public class WorkflowCancellationRegistry {

    private final Map<String, WorkflowCancellation> running = new ConcurrentHashMap<>();

    public WorkflowCancellation register(String workItemId) {
        WorkflowCancellation cancellation = new WorkflowCancellation();
        running.put(workItemId, cancellation);
        return cancellation;
    }

    /**
     * @return 存在运行中的工作流并已发出取消信号时返回 true
     */
    public boolean cancel(String workItemId) {
        WorkflowCancellation cancellation = workItemId == null ? null : running.get(workItemId);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel();
        return true;
    }

    public void remove(String workItemId) {
        if (workItemId != null) {
            running.remove(workItemId);
        }
    }

    public boolean isRunning(String workItemId) {
        return workItemId != null && running.containsKey(workItemId);
    }

    public int size() {
        return running.size();
    }
}
