package com.flowpilot.infrastructure.repository.agent;

import com.flowpilot.domain.agent.adapter.repository.IAgentDefinitionRepository;
import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.infrastructure.dao.AgentDefinitionDao;
import com.flowpilot.infrastructure.dao.po.AgentDefinitionPO;
import com.flowpilot.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 定义仓储实现，toolIds 以 JSON 数组存储。
 */
@Repository
public class AgentDefinitionRepositoryImpl implements IAgentDefinitionRepository {

    private final AgentDefinitionDao agentDefinitionDao;
    private final JsonCodec jsonCodec;

    public AgentDefinitionRepositoryImpl(AgentDefinitionDao agentDefinitionDao, JsonCodec jsonCodec) {
        this.agentDefinitionDao = agentDefinitionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AgentDefinitionEntity save(AgentDefinitionEntity entity) {
        entity.validate();
        LocalDateTime now = LocalDateTime.now();
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        AgentDefinitionPO po = toPO(entity);
        agentDefinitionDao.insert(po);
        return toEntity(po);
    }

    @Override
    public AgentDefinitionEntity update(AgentDefinitionEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for AgentDefinition update: " + entity.getId());
        }
        entity.setUpdatedAt(LocalDateTime.now());
        AgentDefinitionPO po = toPO(entity);
        int affected = agentDefinitionDao.updateWithVersion(po);
        if (affected == 0) {
            throw new IllegalStateException("Optimistic lock failed for AgentDefinition: " + entity.getId());
        }
        Integer newVersion = oldVersion + 1;
        entity.setVersion(newVersion);
        po.setVersion(newVersion);
        return toEntity(po);
    }

    @Override
    public boolean deleteById(Long id) {
        return agentDefinitionDao.deleteById(id) > 0;
    }

    @Override
    public AgentDefinitionEntity findById(Long id) {
        return toEntity(agentDefinitionDao.selectById(id));
    }

    @Override
    public AgentDefinitionEntity findByName(String name) {
        return toEntity(agentDefinitionDao.selectByName(name));
    }

    @Override
    public List<AgentDefinitionEntity> findByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        return agentDefinitionDao.selectByIds(ids).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentDefinitionEntity> findAll() {
        return agentDefinitionDao.selectAll().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private AgentDefinitionEntity toEntity(AgentDefinitionPO po) {
        if (po == null) {
            return null;
        }
        AgentDefinitionEntity entity = new AgentDefinitionEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setKind(po.getKind());
        entity.setDescription(po.getDescription());
        entity.setSystemPrompt(po.getSystemPrompt());
        List<String> toolIds = jsonCodec.readStringList(po.getToolIds());
        entity.setToolIds(toolIds == null ? new ArrayList<>() : toolIds);
        entity.setLlmConfigId(po.getLlmConfigId());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private AgentDefinitionPO toPO(AgentDefinitionEntity entity) {
        return AgentDefinitionPO.builder()
                .id(entity.getId())
                .name(entity.getName())
                .kind(entity.getKind())
                .description(entity.getDescription())
                .systemPrompt(entity.getSystemPrompt())
                .toolIds(jsonCodec.writeValue(entity.getToolIds() == null ? new ArrayList<>() : entity.getToolIds()))
                .llmConfigId(entity.getLlmConfigId())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
