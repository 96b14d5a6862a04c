package com.flowpilot.infrastructure.dao;

import com.flowpilot.infrastructure.dao.po.WorkflowPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 工作流定义 DAO
 */
@Mapper
public interface WorkflowDao {

    int insert(WorkflowPO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(WorkflowPO po);

    int deleteById(@Param("id") Long id);

    WorkflowPO selectById(@Param("id") Long id);

    WorkflowPO selectByName(@Param("name") String name);

    List<WorkflowPO> selectAll();
}
