package com.overseer.infrastructure.repository.workflow;

import com.google.common.cache.Cache;
import com.overseer.domain.workflow.adapter.repository.IWorkflowStateRepository;
import com.overseer.domain.workflow.model.entity.WorkflowStateEntity;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * 工作流状态仓储：Guava Cache 保存每个工作项最近一次运行的状态，按写入时间过期。
 */
@Repository
public class GuavaWorkflowStateRepositoryImpl implements IWorkflowStateRepository {

    private final Cache<String, WorkflowStateEntity> workflowStateCache;

    public GuavaWorkflowStateRepositoryImpl(@Qualifier("workflowStateCache") Cache<String, WorkflowStateEntity> workflowStateCache) {
        this.workflowStateCache = workflowStateCache;
    }

    @Override
    public void save(WorkflowStateEntity state) {
        if (state == null || StringUtils.isBlank(state.getWorkItemId())) {
            throw new IllegalArgumentException("Workflow state must carry a work item id");
        }
        workflowStateCache.put(state.getWorkItemId(), state);
    }

    @Override
    public WorkflowStateEntity findByWorkItemId(String workItemId) {
        if (StringUtils.isBlank(workItemId)) {
            return null;
        }
        return workflowStateCache.getIfPresent(workItemId);
    }
}
