package com.overseer.domain.workflow.service;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.domain.workflow.adapter.gateway.IReplyReader;
import com.overseer.domain.workflow.adapter.gateway.IWorkflowLogger;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workflow.model.valobj.WorkflowCancellation;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;

/**
 * 单次运行的阶段上下文：工作项、配置与引擎持有的协作者。
 * 每次 executeWorkflow 新建一个，运行之间不共享。
 */
public record WorkflowPhaseContext(WorkItemEntity workItem,
                                   WorkerConfig config,
                                   IAgentGateway gateway,
                                   IReplyReader replyReader,
                                   IWorkflowLogger log,
                                   WorkflowCancellation cancellation) {

    public String workItemId() {
        return workItem == null ? null : workItem.getId();
    }
}
