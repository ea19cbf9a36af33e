package com.overseer.domain.workflow.adapter.repository;

import com.overseer.domain.workflow.model.entity.WorkflowStateEntity;

/**
 * 工作流终态仓储接口：保存每个工作项最近一次运行的状态。
 */
public interface IWorkflowStateRepository {

    void save(WorkflowStateEntity state);

    WorkflowStateEntity findByWorkItemId(String workItemId);
}
