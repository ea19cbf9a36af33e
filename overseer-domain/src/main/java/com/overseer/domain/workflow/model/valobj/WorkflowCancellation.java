package com.overseer.domain.workflow.model.valobj;

import com.overseer.types.common.Constants;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 工作流取消句柄，由发起方持有，引擎在阶段边界检查。
 */
public final class WorkflowCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static WorkflowCancellation none() {
        return new WorkflowCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new AppException(ResponseCode.WORKFLOW_CANCELLED.getCode(), Constants.CANCELLED_ERROR);
        }
    }
}
