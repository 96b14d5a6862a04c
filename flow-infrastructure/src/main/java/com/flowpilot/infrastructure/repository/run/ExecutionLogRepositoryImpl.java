package com.flowpilot.infrastructure.repository.run;

import com.flowpilot.domain.run.adapter.repository.IExecutionLogRepository;
import com.flowpilot.domain.run.model.entity.ExecutionLogEntity;
import com.flowpilot.infrastructure.dao.ExecutionLogDao;
import com.flowpilot.infrastructure.dao.po.ExecutionLogPO;
import com.flowpilot.types.enums.ExecutionLogPhaseEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 执行日志仓储实现。同一运行只有一个执行线程写日志，序号取当前最大值加一。
 */
@Repository
public class ExecutionLogRepositoryImpl implements IExecutionLogRepository {

    private final ExecutionLogDao executionLogDao;

    public ExecutionLogRepositoryImpl(ExecutionLogDao executionLogDao) {
        this.executionLogDao = executionLogDao;
    }

    @Override
    public ExecutionLogEntity append(ExecutionLogEntity entity) {
        Integer max = executionLogDao.selectMaxSeqNo(entity.getRunId());
        entity.setSequence(max == null ? 1 : max + 1);
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now());
        }
        ExecutionLogPO po = ExecutionLogPO.builder()
                .runId(entity.getRunId())
                .seqNo(entity.getSequence())
                .phase(entity.getPhase() == null ? null : entity.getPhase().getCode())
                .label(entity.getLabel())
                .payload(entity.getPayload())
                .createdAt(entity.getCreatedAt())
                .build();
        executionLogDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public List<ExecutionLogEntity> findByRunId(Long runId, int limit) {
        if (runId == null || limit <= 0) {
            return Collections.emptyList();
        }
        return executionLogDao.selectByRunId(runId, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private ExecutionLogEntity toEntity(ExecutionLogPO po) {
        ExecutionLogEntity entity = new ExecutionLogEntity();
        entity.setId(po.getId());
        entity.setRunId(po.getRunId());
        entity.setSequence(po.getSeqNo());
        entity.setPhase(ExecutionLogPhaseEnum.fromCode(po.getPhase()));
        entity.setLabel(po.getLabel());
        entity.setPayload(po.getPayload());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
