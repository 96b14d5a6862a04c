package com.flowpilot.infrastructure.dao;

import com.flowpilot.infrastructure.dao.po.WorkflowJobPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 执行队列任务 DAO
 */
@Mapper
public interface WorkflowJobDao {

    int insert(WorkflowJobPO po);

    int update(WorkflowJobPO po);

    WorkflowJobPO selectById(@Param("id") Long id);

    /**
     * 可认领的任务：queued 且同一运行没有 running 任务，按创建顺序
     */
    List<WorkflowJobPO> selectClaimCandidates(@Param("limit") Integer limit);

    /**
     * CAS 认领：仅当仍为 queued 时标记为 running
     */
    int markRunning(@Param("id") Long id, @Param("startedAt") LocalDateTime startedAt);

    int countByStatus(@Param("status") String status);

    List<WorkflowJobPO> selectRecent(@Param("status") String status, @Param("limit") Integer limit);

    List<WorkflowJobPO> selectRunningStartedBefore(@Param("before") LocalDateTime before);

    int deleteQueuedByRunId(@Param("runId") Long runId);
}
