package com.flowpilot.infrastructure.dao;

import com.flowpilot.infrastructure.dao.po.WorkflowRunPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 工作流运行 DAO
 */
@Mapper
public interface WorkflowRunDao {

    /**
     * 插入运行
     */
    int insert(WorkflowRunPO po);

    /**
     * 根据 ID 更新 (带乐观锁，不写 cancel_requested)
     */
    int updateWithVersion(WorkflowRunPO po);

    /**
     * 根据 ID 查询
     */
    WorkflowRunPO selectById(@Param("id") Long id);

    /**
     * 最近的运行，按创建时间倒序
     */
    List<WorkflowRunPO> selectRecent(@Param("limit") Integer limit);

    /**
     * 按状态查询
     */
    List<WorkflowRunPO> selectByStatus(@Param("status") String status, @Param("limit") Integer limit);

    /**
     * 设置取消标记，不改版本号
     */
    int markCancelRequested(@Param("id") Long id);

    Boolean selectCancelRequested(@Param("id") Long id);
}
