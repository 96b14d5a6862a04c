package com.flowpilot.test.support;

import com.flowpilot.domain.agent.adapter.repository.IAgentDefinitionRepository;
import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 内存 Agent 仓储。
 */
public class InMemoryAgentDefinitionRepository implements IAgentDefinitionRepository {

    private final Map<Long, AgentDefinitionEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public AgentDefinitionEntity save(AgentDefinitionEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        entity.setVersion(0);
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public AgentDefinitionEntity update(AgentDefinitionEntity entity) {
        entity.setVersion(entity.getVersion() == null ? 1 : entity.getVersion() + 1);
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public boolean deleteById(Long id) {
        return store.remove(id) != null;
    }

    @Override
    public AgentDefinitionEntity findById(Long id) {
        return store.get(id);
    }

    @Override
    public AgentDefinitionEntity findByName(String name) {
        AgentDefinitionEntity found = null;
        for (AgentDefinitionEntity entity : store.values()) {
            if (entity.getName() != null && entity.getName().equals(name)) {
                found = entity;
            }
        }
        return found;
    }

    @Override
    public List<AgentDefinitionEntity> findByIds(List<Long> ids) {
        return store.values().stream().filter(item -> ids.contains(item.getId())).collect(Collectors.toList());
    }

    @Override
    public List<AgentDefinitionEntity> findAll() {
        return new ArrayList<>(store.values());
    }
}
