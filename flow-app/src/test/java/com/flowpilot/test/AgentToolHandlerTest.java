package com.flowpilot.test;

import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.tool.service.handler.AgentToolHandler;
import com.flowpilot.test.support.InMemoryAgentDefinitionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AgentToolHandlerTest {

    private InMemoryAgentDefinitionRepository agentRepository;
    private AgentToolHandler handler;

    @BeforeEach
    public void setUp() {
        this.agentRepository = new InMemoryAgentDefinitionRepository();
        this.handler = new AgentToolHandler(agentRepository);
    }

    @Test
    public void shouldRejectAgentWithTooManyTools() {
        List<String> tools = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            tools.add("tool_" + i);
        }

        Map<?, ?> result = (Map<?, ?>) handler.execute("create_agent",
                Map.of("name", "Kitchen Sink", "toolIds", tools), ToolExecutionContext.empty());

        assertEquals("TOOL_CAP_EXCEEDED", result.get("code"));
        assertEquals(10, result.get("maxToolsPerAgent"));
        assertTrue(String.valueOf(result.get("error")).startsWith("This agent would have 11 tools"));
        assertTrue(agentRepository.findAll().isEmpty());
    }

    @Test
    public void shouldCreateThenUpdateByName() {
        handler.execute("create_agent", Map.of("name", "Researcher", "systemPrompt", "Find sources.",
                "toolIds", List.of("http_get")), ToolExecutionContext.empty());

        Map<?, ?> updated = (Map<?, ?>) handler.execute("update_agent",
                Map.of("name", "Researcher", "systemPrompt", "Find primary sources."), ToolExecutionContext.empty());

        AgentDefinitionEntity agent = agentRepository.findByName("Researcher");
        assertEquals("Agent \"Researcher\" updated", updated.get("message"));
        assertEquals("Find primary sources.", agent.getSystemPrompt());
        assertEquals(List.of("http_get"), agent.getToolIds());
        assertEquals("llm", agent.getKind());
    }

    @Test
    public void shouldReportUnknownAgent() {
        assertEquals(Map.of("error", "Agent not found"),
                handler.execute("get_agent", Map.of("id", 5), ToolExecutionContext.empty()));
        assertEquals(Map.of("error", "Agent not found"),
                handler.execute("delete_agent", Map.of("id", 5), ToolExecutionContext.empty()));
    }
}
