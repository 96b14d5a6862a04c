package com.flowpilot.domain.run.adapter.repository;

import com.flowpilot.domain.run.model.entity.ExecutionLogEntity;

import java.util.List;

/**
 * 执行日志仓储接口
 */
public interface IExecutionLogRepository {

    /**
     * 追加日志，序号由仓储分配
     */
    ExecutionLogEntity append(ExecutionLogEntity entity);

    /**
     * 按序号升序查询
     */
    List<ExecutionLogEntity> findByRunId(Long runId, int limit);
}
