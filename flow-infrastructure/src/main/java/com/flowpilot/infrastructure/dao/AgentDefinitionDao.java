package com.flowpilot.infrastructure.dao;

import com.flowpilot.infrastructure.dao.po.AgentDefinitionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Agent 定义 DAO
 */
@Mapper
public interface AgentDefinitionDao {

    int insert(AgentDefinitionPO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(AgentDefinitionPO po);

    int deleteById(@Param("id") Long id);

    AgentDefinitionPO selectById(@Param("id") Long id);

    /**
     * 同名时取最新创建的一条
     */
    AgentDefinitionPO selectByName(@Param("name") String name);

    List<AgentDefinitionPO> selectByIds(@Param("ids") List<Long> ids);

    List<AgentDefinitionPO> selectAll();
}
