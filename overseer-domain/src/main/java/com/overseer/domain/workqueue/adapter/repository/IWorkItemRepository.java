package com.overseer.domain.workqueue.adapter.repository;

import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.types.enums.WorkItemStatusEnum;

import java.util.List;

/**
 * 工作项仓储接口（外部工作队列的端口）。
 *
 * @author getoffer
 * @since 2026-02-03
 */
public interface IWorkItemRepository {

    /**
     * 保存新工作项，未指定 ID 时由仓储生成。
     */
    WorkItemEntity save(WorkItemEntity item);

    /**
     * 按状态条件更新：仅当仓储中的当前状态仍为 expectedStatus 时写入，防止并发写入互相覆盖。
     *
     * @param item 修改后的工作项
     * @param expectedStatus 读取时的状态
     * @return 是否写入成功
     */
    boolean updateIfStatus(WorkItemEntity item, WorkItemStatusEnum expectedStatus);

    /**
     * 根据 ID 查询。
     */
    WorkItemEntity findById(String id);

    /**
     * 查询队列内的全部工作项，按创建时间升序。
     */
    List<WorkItemEntity> listByQueue(String queueId);

    /**
     * 原子领取队列中下一个待处理工作项。
     *
     * @param queueId 队列 ID
     * @param sessionKey 领取方会话 Key
     * @return 被领取的工作项，无可领取项时返回 null
     */
    WorkItemEntity claimNext(String queueId, String sessionKey);
}
