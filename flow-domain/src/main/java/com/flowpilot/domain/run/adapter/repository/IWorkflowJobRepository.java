package com.flowpilot.domain.run.adapter.repository;

import com.flowpilot.domain.run.model.entity.WorkflowJobEntity;
import com.flowpilot.types.enums.WorkflowJobStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 执行队列仓储接口
 */
public interface IWorkflowJobRepository {

    /**
     * 入队
     */
    WorkflowJobEntity save(WorkflowJobEntity entity);

    /**
     * 更新状态、错误与时间戳
     */
    WorkflowJobEntity update(WorkflowJobEntity entity);

    /**
     * 根据 ID 查询
     */
    WorkflowJobEntity findById(Long id);

    /**
     * 认领最早的可执行任务：状态为 queued，且同一运行没有 running 任务。
     * 认领成功后任务已标记为 running，无可认领任务时返回 null。
     */
    WorkflowJobEntity claimNext();

    /**
     * 按状态计数
     */
    int countByStatus(WorkflowJobStatusEnum status);

    /**
     * 最近任务，status 为空时不过滤
     */
    List<WorkflowJobEntity> findRecent(WorkflowJobStatusEnum status, int limit);

    /**
     * 开始时间早于给定时间仍在执行的任务
     */
    List<WorkflowJobEntity> findRunningStartedBefore(LocalDateTime before);

    /**
     * 删除运行尚未开始的任务
     */
    int deleteQueuedByRunId(Long runId);
}
