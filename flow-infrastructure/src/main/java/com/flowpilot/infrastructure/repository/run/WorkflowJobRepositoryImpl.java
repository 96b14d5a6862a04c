package com.flowpilot.infrastructure.repository.run;

import com.flowpilot.domain.run.adapter.repository.IWorkflowJobRepository;
import com.flowpilot.domain.run.model.entity.WorkflowJobEntity;
import com.flowpilot.infrastructure.dao.WorkflowJobDao;
import com.flowpilot.infrastructure.dao.po.WorkflowJobPO;
import com.flowpilot.infrastructure.util.JsonCodec;
import com.flowpilot.types.enums.WorkflowJobStatusEnum;
import com.flowpilot.types.enums.WorkflowJobTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 执行队列仓储实现。认领采用"先查候选、再按状态 CAS 更新"，多个工作线程竞争同一任务时只有一个成功。
 */
@Slf4j
@Repository
public class WorkflowJobRepositoryImpl implements IWorkflowJobRepository {

    private static final int CLAIM_CANDIDATES = 8;

    private final WorkflowJobDao workflowJobDao;
    private final JsonCodec jsonCodec;

    public WorkflowJobRepositoryImpl(WorkflowJobDao workflowJobDao, JsonCodec jsonCodec) {
        this.workflowJobDao = workflowJobDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public WorkflowJobEntity save(WorkflowJobEntity entity) {
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now());
        }
        WorkflowJobPO po = toPO(entity);
        workflowJobDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public WorkflowJobEntity update(WorkflowJobEntity entity) {
        int affected = workflowJobDao.update(toPO(entity));
        if (affected == 0) {
            throw new IllegalStateException("Workflow job not found: " + entity.getId());
        }
        return entity;
    }

    @Override
    public WorkflowJobEntity findById(Long id) {
        return id == null ? null : toEntity(workflowJobDao.selectById(id));
    }

    @Override
    public WorkflowJobEntity claimNext() {
        for (WorkflowJobPO candidate : workflowJobDao.selectClaimCandidates(CLAIM_CANDIDATES)) {
            LocalDateTime startedAt = LocalDateTime.now();
            if (workflowJobDao.markRunning(candidate.getId(), startedAt) > 0) {
                candidate.setStatus(WorkflowJobStatusEnum.RUNNING.getCode());
                candidate.setStartedAt(startedAt);
                return toEntity(candidate);
            }
            log.debug("Workflow job claimed by another worker. jobId={}", candidate.getId());
        }
        return null;
    }

    @Override
    public int countByStatus(WorkflowJobStatusEnum status) {
        return workflowJobDao.countByStatus(status == null ? null : status.getCode());
    }

    @Override
    public List<WorkflowJobEntity> findRecent(WorkflowJobStatusEnum status, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return workflowJobDao.selectRecent(status == null ? null : status.getCode(), limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowJobEntity> findRunningStartedBefore(LocalDateTime before) {
        return workflowJobDao.selectRunningStartedBefore(before).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteQueuedByRunId(Long runId) {
        return runId == null ? 0 : workflowJobDao.deleteQueuedByRunId(runId);
    }

    private WorkflowJobEntity toEntity(WorkflowJobPO po) {
        if (po == null) {
            return null;
        }
        WorkflowJobEntity entity = new WorkflowJobEntity();
        entity.setId(po.getId());
        entity.setType(WorkflowJobTypeEnum.fromCode(po.getJobType()));
        entity.setRunId(po.getRunId());
        entity.setStatus(WorkflowJobStatusEnum.fromCode(po.getStatus()));
        Map<String, Object> payload = jsonCodec.readMap(po.getPayload());
        entity.setPayload(payload == null ? new LinkedHashMap<>() : payload);
        entity.setError(po.getError());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setFinishedAt(po.getFinishedAt());
        return entity;
    }

    private WorkflowJobPO toPO(WorkflowJobEntity entity) {
        return WorkflowJobPO.builder()
                .id(entity.getId())
                .jobType(entity.getType() == null ? null : entity.getType().getCode())
                .runId(entity.getRunId())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .payload(jsonCodec.writeValue(entity.getPayload()))
                .error(entity.getError())
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .finishedAt(entity.getFinishedAt())
                .build();
    }
}
