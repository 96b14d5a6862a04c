package com.flowpilot.infrastructure.repository.run;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flowpilot.domain.run.adapter.repository.IWorkflowRunRepository;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.model.valobj.ResumeCursor;
import com.flowpilot.domain.run.model.valobj.TrailStep;
import com.flowpilot.domain.run.model.valobj.WorkflowSnapshot;
import com.flowpilot.infrastructure.dao.WorkflowRunDao;
import com.flowpilot.infrastructure.dao.po.WorkflowRunPO;
import com.flowpilot.infrastructure.util.JsonCodec;
import com.flowpilot.types.enums.RunStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流运行仓储实现。
 * <p>
 * 轨迹、游标、快照与输出以 JSON 存储在 TEXT 列。
 * update 带乐观锁并原地推进实体版本号，取消标记只通过 {@link #requestCancel(Long)} 写入，
 * 执行线程的持久化不会覆盖并发到达的取消请求。
 * </p>
 */
@Slf4j
@Repository
public class WorkflowRunRepositoryImpl implements IWorkflowRunRepository {

    private static final TypeReference<List<TrailStep>> TRAIL_REF = new TypeReference<List<TrailStep>>() {};

    private final WorkflowRunDao workflowRunDao;
    private final JsonCodec jsonCodec;

    public WorkflowRunRepositoryImpl(WorkflowRunDao workflowRunDao, JsonCodec jsonCodec) {
        this.workflowRunDao = workflowRunDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public WorkflowRunEntity save(WorkflowRunEntity entity) {
        entity.validate();
        LocalDateTime now = LocalDateTime.now();
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);
        entity.setVersion(0);
        if (entity.getCancelRequested() == null) {
            entity.setCancelRequested(false);
        }
        WorkflowRunPO po = toPO(entity);
        workflowRunDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public WorkflowRunEntity update(WorkflowRunEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for WorkflowRun update: " + entity.getId());
        }
        entity.setUpdatedAt(LocalDateTime.now());
        int affected = workflowRunDao.updateWithVersion(toPO(entity));
        if (affected == 0) {
            log.warn("Optimistic lock conflict on run update. runId={}, version={}", entity.getId(), oldVersion);
            throw new IllegalStateException("Optimistic lock failed for WorkflowRun: " + entity.getId());
        }
        entity.setVersion(oldVersion + 1);
        return entity;
    }

    @Override
    public WorkflowRunEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        return toEntity(workflowRunDao.selectById(id));
    }

    @Override
    public List<WorkflowRunEntity> findRecent(int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return workflowRunDao.selectRecent(limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowRunEntity> findByStatus(RunStatusEnum status, int limit) {
        if (status == null || limit <= 0) {
            return Collections.emptyList();
        }
        return workflowRunDao.selectByStatus(status.getCode(), limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean requestCancel(Long id) {
        return id != null && workflowRunDao.markCancelRequested(id) > 0;
    }

    @Override
    public boolean isCancelRequested(Long id) {
        return id != null && Boolean.TRUE.equals(workflowRunDao.selectCancelRequested(id));
    }

    private WorkflowRunEntity toEntity(WorkflowRunPO po) {
        if (po == null) {
            return null;
        }
        WorkflowRunEntity entity = new WorkflowRunEntity();
        entity.setId(po.getId());
        entity.setWorkflowId(po.getWorkflowId());
        entity.setStatus(RunStatusEnum.fromCode(po.getStatus()));
        entity.setInitialInput(po.getInitialInput());
        entity.setOutput(jsonCodec.readMap(po.getOutput()));
        List<TrailStep> trail = jsonCodec.readValue(po.getTrail(), TRAIL_REF);
        entity.setTrail(trail == null ? new ArrayList<>() : new ArrayList<>(trail));
        entity.setCursor(jsonCodec.readValue(po.getResumeCursor(), ResumeCursor.class));
        entity.setSnapshot(jsonCodec.readValue(po.getWorkflowSnapshot(), WorkflowSnapshot.class));
        entity.setRetryOfRunId(po.getRetryOfRunId());
        entity.setRetryAttempt(po.getRetryAttempt());
        entity.setCancelRequested(po.getCancelRequested());
        entity.setActiveJobId(po.getActiveJobId());
        entity.setVersion(po.getVersion());
        entity.setStartedAt(po.getStartedAt());
        entity.setFinishedAt(po.getFinishedAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private WorkflowRunPO toPO(WorkflowRunEntity entity) {
        return WorkflowRunPO.builder()
                .id(entity.getId())
                .workflowId(entity.getWorkflowId())
                .status(entity.getStatus().getCode())
                .initialInput(entity.getInitialInput())
                .output(jsonCodec.writeValue(entity.getOutput()))
                .trail(jsonCodec.writeValue(entity.getTrail() == null ? new ArrayList<>() : entity.getTrail()))
                .resumeCursor(jsonCodec.writeValue(entity.getCursor()))
                .workflowSnapshot(jsonCodec.writeValue(entity.getSnapshot()))
                .retryOfRunId(entity.getRetryOfRunId())
                .retryAttempt(entity.getRetryAttempt())
                .cancelRequested(entity.getCancelRequested())
                .activeJobId(entity.getActiveJobId())
                .version(entity.getVersion())
                .startedAt(entity.getStartedAt())
                .finishedAt(entity.getFinishedAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
