package com.flowpilot.test.support;

import com.flowpilot.domain.run.adapter.repository.IWorkflowRunRepository;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.types.enums.RunStatusEnum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 内存运行仓储。取消标记单独存放，与数据库实现一样不随 update 覆盖。
 */
public class InMemoryWorkflowRunRepository implements IWorkflowRunRepository {

    private final Map<Long, WorkflowRunEntity> store = new LinkedHashMap<>();
    private final Set<Long> cancelRequested = new HashSet<>();
    private final List<String> updateLog = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized WorkflowRunEntity save(WorkflowRunEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        entity.setVersion(0);
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public synchronized WorkflowRunEntity update(WorkflowRunEntity entity) {
        if (entity == null || entity.getId() == null) {
            return entity;
        }
        entity.setVersion(entity.getVersion() == null ? 1 : entity.getVersion() + 1);
        store.put(entity.getId(), entity);
        updateLog.add(entity.getId() + ":" + entity.getStatus().getCode());
        return entity;
    }

    @Override
    public synchronized WorkflowRunEntity findById(Long id) {
        WorkflowRunEntity entity = store.get(id);
        if (entity != null) {
            entity.setCancelRequested(cancelRequested.contains(id));
        }
        return entity;
    }

    @Override
    public synchronized List<WorkflowRunEntity> findRecent(int limit) {
        List<WorkflowRunEntity> runs = new ArrayList<>(store.values());
        Collections.reverse(runs);
        return runs.stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized List<WorkflowRunEntity> findByStatus(RunStatusEnum status, int limit) {
        return store.values().stream()
                .filter(item -> item.getStatus() == status)
                .sorted(Comparator.comparing(WorkflowRunEntity::getId))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean requestCancel(Long id) {
        if (!store.containsKey(id)) {
            return false;
        }
        cancelRequested.add(id);
        return true;
    }

    @Override
    public synchronized boolean isCancelRequested(Long id) {
        return cancelRequested.contains(id);
    }

    public synchronized List<String> getUpdateLog() {
        return new ArrayList<>(updateLog);
    }
}
