package com.flowpilot.domain.workflow.adapter.repository;

import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;

import java.util.List;

/**
 * 工作流定义仓储接口
 */
public interface IWorkflowRepository {

    /**
     * 保存工作流
     */
    WorkflowEntity save(WorkflowEntity entity);

    /**
     * 更新工作流 (带乐观锁)
     */
    WorkflowEntity update(WorkflowEntity entity);

    /**
     * 根据 ID 删除
     */
    boolean deleteById(Long id);

    /**
     * 根据 ID 查询
     */
    WorkflowEntity findById(Long id);

    /**
     * 根据名称查询，同名时取最新创建的一条
     */
    WorkflowEntity findByName(String name);

    /**
     * 查询全部
     */
    List<WorkflowEntity> findAll();
}
