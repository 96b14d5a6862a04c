package com.flowpilot.domain.agent.adapter.repository;

import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;

import java.util.List;

/**
 * Agent 定义仓储接口
 */
public interface IAgentDefinitionRepository {

    /**
     * 保存 Agent
     */
    AgentDefinitionEntity save(AgentDefinitionEntity entity);

    /**
     * 更新 Agent (带乐观锁)
     */
    AgentDefinitionEntity update(AgentDefinitionEntity entity);

    /**
     * 根据 ID 删除
     */
    boolean deleteById(Long id);

    /**
     * 根据 ID 查询
     */
    AgentDefinitionEntity findById(Long id);

    /**
     * 根据名称查询，同名时取最新创建的一条
     */
    AgentDefinitionEntity findByName(String name);

    /**
     * 根据 ID 批量查询
     */
    List<AgentDefinitionEntity> findByIds(List<Long> ids);

    /**
     * 查询全部
     */
    List<AgentDefinitionEntity> findAll();
}
