package com.flowpilot.infrastructure.dao;

import com.flowpilot.infrastructure.dao.po.ExecutionLogPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 运行调试日志 DAO
 */
@Mapper
public interface ExecutionLogDao {

    int insert(ExecutionLogPO po);

    Integer selectMaxSeqNo(@Param("runId") Long runId);

    List<ExecutionLogPO> selectByRunId(@Param("runId") Long runId, @Param("limit") Integer limit);
}
