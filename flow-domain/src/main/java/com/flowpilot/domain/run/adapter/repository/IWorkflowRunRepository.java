package com.flowpilot.domain.run.adapter.repository;

import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.types.enums.RunStatusEnum;

import java.util.List;

/**
 * 运行记录仓储接口
 */
public interface IWorkflowRunRepository {

    /**
     * 保存运行
     */
    WorkflowRunEntity save(WorkflowRunEntity entity);

    /**
     * 更新运行 (带乐观锁，不覆盖取消标记)
     */
    WorkflowRunEntity update(WorkflowRunEntity entity);

    /**
     * 根据 ID 查询
     */
    WorkflowRunEntity findById(Long id);

    /**
     * 最近的运行，按创建时间倒序
     */
    List<WorkflowRunEntity> findRecent(int limit);

    /**
     * 按状态查询
     */
    List<WorkflowRunEntity> findByStatus(RunStatusEnum status, int limit);

    /**
     * 设置取消标记，返回是否命中
     */
    boolean requestCancel(Long id);

    /**
     * 读取最新的取消标记
     */
    boolean isCancelRequested(Long id);
}
