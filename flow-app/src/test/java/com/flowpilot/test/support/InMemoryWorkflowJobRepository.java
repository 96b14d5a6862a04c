package com.flowpilot.test.support;

import com.flowpilot.domain.run.adapter.repository.IWorkflowJobRepository;
import com.flowpilot.domain.run.model.entity.WorkflowJobEntity;
import com.flowpilot.types.enums.WorkflowJobStatusEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存队列仓储，认领规则与 SQL 实现一致：最早的 queued 任务，且同一运行没有 running 任务。
 */
public class InMemoryWorkflowJobRepository implements IWorkflowJobRepository {

    private final Map<Long, WorkflowJobEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized WorkflowJobEntity save(WorkflowJobEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public synchronized WorkflowJobEntity update(WorkflowJobEntity entity) {
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public synchronized WorkflowJobEntity findById(Long id) {
        return store.get(id);
    }

    @Override
    public synchronized WorkflowJobEntity claimNext() {
        for (WorkflowJobEntity job : store.values()) {
            if (job.getStatus() != WorkflowJobStatusEnum.QUEUED || hasRunningJob(job.getRunId())) {
                continue;
            }
            job.setStatus(WorkflowJobStatusEnum.RUNNING);
            job.setStartedAt(LocalDateTime.now());
            return job;
        }
        return null;
    }

    @Override
    public synchronized int countByStatus(WorkflowJobStatusEnum status) {
        return (int) store.values().stream().filter(job -> job.getStatus() == status).count();
    }

    @Override
    public synchronized List<WorkflowJobEntity> findRecent(WorkflowJobStatusEnum status, int limit) {
        List<WorkflowJobEntity> jobs = store.values().stream()
                .filter(job -> status == null || job.getStatus() == status)
                .collect(Collectors.toList());
        Collections.reverse(jobs);
        return jobs.stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowJobEntity> findRunningStartedBefore(LocalDateTime before) {
        return store.values().stream()
                .filter(job -> job.getStatus() == WorkflowJobStatusEnum.RUNNING)
                .filter(job -> job.getStartedAt() != null && job.getStartedAt().isBefore(before))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int deleteQueuedByRunId(Long runId) {
        List<Long> ids = new ArrayList<>();
        for (WorkflowJobEntity job : store.values()) {
            if (Objects.equals(runId, job.getRunId()) && job.getStatus() == WorkflowJobStatusEnum.QUEUED) {
                ids.add(job.getId());
            }
        }
        ids.forEach(store::remove);
        return ids.size();
    }

    public synchronized List<WorkflowJobEntity> findAll() {
        return new ArrayList<>(store.values());
    }

    private boolean hasRunningJob(Long runId) {
        return store.values().stream()
                .anyMatch(job -> Objects.equals(runId, job.getRunId()) && job.getStatus() == WorkflowJobStatusEnum.RUNNING);
    }
}
