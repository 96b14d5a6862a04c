package com.flowpilot.infrastructure.repository.workflow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flowpilot.domain.workflow.adapter.repository.IWorkflowRepository;
import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;
import com.flowpilot.domain.workflow.model.valobj.WorkflowEdge;
import com.flowpilot.domain.workflow.model.valobj.WorkflowNode;
import com.flowpilot.infrastructure.dao.WorkflowDao;
import com.flowpilot.infrastructure.dao.po.WorkflowPO;
import com.flowpilot.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流定义仓储实现，节点与边以 JSON 数组存储。
 */
@Repository
public class WorkflowRepositoryImpl implements IWorkflowRepository {

    private static final TypeReference<List<WorkflowNode>> NODES_REF = new TypeReference<List<WorkflowNode>>() {};
    private static final TypeReference<List<WorkflowEdge>> EDGES_REF = new TypeReference<List<WorkflowEdge>>() {};

    private final WorkflowDao workflowDao;
    private final JsonCodec jsonCodec;

    public WorkflowRepositoryImpl(WorkflowDao workflowDao, JsonCodec jsonCodec) {
        this.workflowDao = workflowDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public WorkflowEntity save(WorkflowEntity entity) {
        entity.validate();
        LocalDateTime now = LocalDateTime.now();
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        WorkflowPO po = toPO(entity);
        workflowDao.insert(po);
        return toEntity(po);
    }

    @Override
    public WorkflowEntity update(WorkflowEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for Workflow update: " + entity.getId());
        }
        entity.setUpdatedAt(LocalDateTime.now());
        WorkflowPO po = toPO(entity);
        int affected = workflowDao.updateWithVersion(po);
        if (affected == 0) {
            throw new IllegalStateException("Optimistic lock failed for Workflow: " + entity.getId());
        }
        Integer newVersion = oldVersion + 1;
        entity.setVersion(newVersion);
        po.setVersion(newVersion);
        return toEntity(po);
    }

    @Override
    public boolean deleteById(Long id) {
        return workflowDao.deleteById(id) > 0;
    }

    @Override
    public WorkflowEntity findById(Long id) {
        return toEntity(workflowDao.selectById(id));
    }

    @Override
    public WorkflowEntity findByName(String name) {
        return toEntity(workflowDao.selectByName(name));
    }

    @Override
    public List<WorkflowEntity> findAll() {
        return workflowDao.selectAll().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private WorkflowEntity toEntity(WorkflowPO po) {
        if (po == null) {
            return null;
        }
        WorkflowEntity entity = new WorkflowEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        List<WorkflowNode> nodes = jsonCodec.readValue(po.getNodes(), NODES_REF);
        entity.setNodes(nodes == null ? new ArrayList<>() : nodes);
        List<WorkflowEdge> edges = jsonCodec.readValue(po.getEdges(), EDGES_REF);
        entity.setEdges(edges == null ? new ArrayList<>() : edges);
        entity.setMaxRounds(po.getMaxRounds());
        entity.setTurnInstruction(po.getTurnInstruction());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private WorkflowPO toPO(WorkflowEntity entity) {
        return WorkflowPO.builder()
                .id(entity.getId())
                .name(entity.getName())
                .description(entity.getDescription())
                .nodes(jsonCodec.writeValue(entity.getNodes() == null ? new ArrayList<>() : entity.getNodes()))
                .edges(jsonCodec.writeValue(entity.getEdges() == null ? new ArrayList<>() : entity.getEdges()))
                .maxRounds(entity.getMaxRounds())
                .turnInstruction(entity.getTurnInstruction())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
