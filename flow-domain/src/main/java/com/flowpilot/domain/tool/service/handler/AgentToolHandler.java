package com.flowpilot.domain.tool.service.handler;

import com.flowpilot.domain.agent.adapter.repository.IAgentDefinitionRepository;
import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flowpilot.domain.tool.service.ToolArguments.error;
import static com.flowpilot.domain.tool.service.ToolArguments.has;
import static com.flowpilot.domain.tool.service.ToolArguments.longValue;
import static com.flowpilot.domain.tool.service.ToolArguments.string;
import static com.flowpilot.domain.tool.service.ToolArguments.stringList;

/**
 * Agent 管理工具：list / get / create / update / delete。
 * 单个 Agent 的工具数不超过 {@link Constants#MAX_TOOLS_PER_CREATED_AGENT}。
 */
@Slf4j
@Component
public class AgentToolHandler implements IToolHandler {

    private final IAgentDefinitionRepository agentRepository;

    public AgentToolHandler(IAgentDefinitionRepository agentRepository) {
        this.agentRepository = agentRepository;
    }

    @Override
    public Set<String> toolNames() {
        return Set.of("list_agents", "get_agent", "create_agent", "update_agent", "delete_agent");
    }

    @Override
    public String describe(String toolName) {
        switch (toolName) {
            case "create_agent":
                return "Create an LLM agent. Args: name, systemPrompt, description?, toolIds? (at most "
                        + Constants.MAX_TOOLS_PER_CREATED_AGENT + "), llmConfigId?";
            case "update_agent":
                return "Update an agent. Args: id, name?, systemPrompt?, description?, toolIds?, llmConfigId?";
            case "get_agent":
                return "Get an agent by id or name. Args: id | name";
            case "delete_agent":
                return "Delete an agent. Args: id";
            default:
                return "List all agents.";
        }
    }

    @Override
    public Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context) {
        switch (toolName) {
            case "list_agents":
                return listAgents();
            case "get_agent":
                return getAgent(args);
            case "create_agent":
                return createAgent(args);
            case "update_agent":
                return updateAgent(args);
            default:
                return deleteAgent(args);
        }
    }

    private Map<String, Object> listAgents() {
        List<Map<String, Object>> agents = new ArrayList<>();
        for (AgentDefinitionEntity agent : agentRepository.findAll()) {
            agents.add(toView(agent));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("agents", agents);
        return result;
    }

    private Map<String, Object> getAgent(Map<String, Object> args) {
        AgentDefinitionEntity agent = resolveAgent(args);
        return agent == null ? error("Agent not found") : toView(agent);
    }

    private Map<String, Object> createAgent(Map<String, Object> args) {
        List<String> toolIds = stringList(args, "toolIds");
        if (toolIds != null && toolIds.size() > Constants.MAX_TOOLS_PER_CREATED_AGENT) {
            return toolCapExceeded(toolIds.size());
        }
        String name = string(args, "name");
        if (name == null) {
            return error("name is required");
        }
        AgentDefinitionEntity agent = new AgentDefinitionEntity();
        agent.setName(name);
        agent.setKind("llm");
        agent.setDescription(string(args, "description"));
        agent.setSystemPrompt(string(args, "systemPrompt"));
        agent.setToolIds(toolIds == null ? new ArrayList<>() : toolIds);
        agent.setLlmConfigId(string(args, "llmConfigId"));
        agent.setCreatedAt(LocalDateTime.now());
        agent.setUpdatedAt(LocalDateTime.now());
        AgentDefinitionEntity saved = agentRepository.save(agent);
        log.info("Agent created by tool. agentId={}, name={}, tools={}", saved.getId(), name, agent.getToolIds().size());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", saved.getId());
        result.put("name", saved.getName());
        result.put("message", "Agent \"" + saved.getName() + "\" created");
        return result;
    }

    private Map<String, Object> updateAgent(Map<String, Object> args) {
        AgentDefinitionEntity agent = resolveAgent(args);
        if (agent == null) {
            return error("Agent not found");
        }
        List<String> toolIds = stringList(args, "toolIds");
        if (toolIds != null && toolIds.size() > Constants.MAX_TOOLS_PER_CREATED_AGENT) {
            return toolCapExceeded(toolIds.size());
        }
        // 按名称定位时 name 是查询条件，不作为新名称
        if (string(args, "name") != null && longValue(args, "id", "agentId") != null) {
            agent.setName(string(args, "name"));
        }
        if (has(args, "description")) {
            agent.setDescription(string(args, "description"));
        }
        if (has(args, "systemPrompt")) {
            agent.setSystemPrompt(string(args, "systemPrompt"));
        }
        if (has(args, "llmConfigId")) {
            agent.setLlmConfigId(string(args, "llmConfigId"));
        }
        if (toolIds != null) {
            agent.setToolIds(toolIds);
        }
        agent.setUpdatedAt(LocalDateTime.now());
        AgentDefinitionEntity updated = agentRepository.update(agent);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", updated.getId());
        result.put("message", "Agent \"" + updated.getName() + "\" updated");
        return result;
    }

    private Map<String, Object> deleteAgent(Map<String, Object> args) {
        Long id = longValue(args, "id", "agentId");
        if (id == null) {
            return error("id is required");
        }
        if (!agentRepository.deleteById(id)) {
            return error("Agent not found");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", id);
        result.put("message", "Agent deleted");
        return result;
    }

    private AgentDefinitionEntity resolveAgent(Map<String, Object> args) {
        Long id = longValue(args, "id", "agentId");
        if (id != null) {
            return agentRepository.findById(id);
        }
        String name = string(args, "name", "agentName");
        return name == null ? null : agentRepository.findByName(name);
    }

    private Map<String, Object> toolCapExceeded(int requested) {
        int cap = Constants.MAX_TOOLS_PER_CREATED_AGENT;
        Map<String, Object> result = error("This agent would have " + requested
                + " tools, which exceeds the maximum of " + cap + " tools per agent. "
                + "Create multiple agents (each with at most " + cap + " tools) and connect them with a workflow.");
        result.put("code", "TOOL_CAP_EXCEEDED");
        result.put("maxToolsPerAgent", cap);
        return result;
    }

    private Map<String, Object> toView(AgentDefinitionEntity agent) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", agent.getId());
        view.put("name", agent.getName());
        view.put("kind", agent.getKind());
        view.put("description", agent.getDescription());
        view.put("systemPrompt", agent.getSystemPrompt());
        view.put("toolIds", agent.getToolIds());
        view.put("llmConfigId", agent.getLlmConfigId());
        return view;
    }
}
