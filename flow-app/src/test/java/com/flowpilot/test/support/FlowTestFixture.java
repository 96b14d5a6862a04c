package com.flowpilot.test.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.model.valobj.GraphRunnerOptions;
import com.flowpilot.domain.run.model.valobj.WorkflowSnapshot;
import com.flowpilot.domain.run.service.ExecutionLogRecorder;
import com.flowpilot.domain.run.service.NodeTurnExecutor;
import com.flowpilot.domain.run.service.WorkflowGraphRunner;
import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.service.ToolDispatcher;
import com.flowpilot.domain.tool.service.ToolOutcomeClassifier;
import com.flowpilot.domain.tool.service.ToolReferenceResolver;
import com.flowpilot.domain.tool.service.handler.ConversationToolHandler;
import com.flowpilot.domain.tool.service.handler.WorkflowContextToolHandler;
import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;
import com.flowpilot.domain.workflow.model.valobj.EdgeCondition;
import com.flowpilot.domain.workflow.model.valobj.WorkflowEdge;
import com.flowpilot.domain.workflow.model.valobj.WorkflowNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组装内存版图执行环境：仓储、模型网关、工具分发与执行器。
 */
public class FlowTestFixture {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final InMemoryWorkflowRunRepository runRepository = new InMemoryWorkflowRunRepository();
    private final InMemoryExecutionLogRepository logRepository = new InMemoryExecutionLogRepository();
    private final InMemoryWorkflowRepository workflowRepository = new InMemoryWorkflowRepository();
    private final InMemoryAgentDefinitionRepository agentRepository = new InMemoryAgentDefinitionRepository();
    private final ScriptedLlmGateway llmGateway = new ScriptedLlmGateway();
    private final List<IToolHandler> handlers = new ArrayList<>();
    private final GraphRunnerOptions options = GraphRunnerOptions.builder().build();
    private final WorkflowGraphRunner runner;

    public FlowTestFixture(IToolHandler... extraHandlers) {
        handlers.add(new ConversationToolHandler());
        handlers.add(new WorkflowContextToolHandler());
        handlers.addAll(List.of(extraHandlers));
        ToolDispatcher dispatcher = new ToolDispatcher(handlers);
        ExecutionLogRecorder recorder = new ExecutionLogRecorder(logRepository, objectMapper);
        NodeTurnExecutor executor = new NodeTurnExecutor(llmGateway, dispatcher,
                new ToolReferenceResolver(objectMapper), new ToolOutcomeClassifier(), recorder, objectMapper);
        this.runner = new WorkflowGraphRunner(executor, runRepository, recorder, options);
    }

    public AgentDefinitionEntity agent(String name, String systemPrompt, String... toolIds) {
        AgentDefinitionEntity agent = new AgentDefinitionEntity();
        agent.setName(name);
        agent.setKind("llm");
        agent.setSystemPrompt(systemPrompt);
        agent.setToolIds(new ArrayList<>(List.of(toolIds)));
        return agentRepository.save(agent);
    }

    public static WorkflowNode agentNode(String id, AgentDefinitionEntity agent) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("agentId", agent.getId());
        parameters.put("agentName", agent.getName());
        return WorkflowNode.builder().id(id).type("agent").parameters(parameters).build();
    }

    public static WorkflowNode toolNode(String id, String toolName, Map<String, Object> arguments) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("toolName", toolName);
        parameters.put("arguments", arguments);
        return WorkflowNode.builder().id(id).type("tool").parameters(parameters).build();
    }

    public static WorkflowNode waitNode(String id, String question) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("question", question);
        return WorkflowNode.builder().id(id).type("wait_for_user").parameters(parameters).build();
    }

    public static WorkflowEdge edge(String source, String target) {
        return WorkflowEdge.builder().id(source + "-" + target).source(source).target(target).build();
    }

    public static WorkflowEdge containsEdge(String source, String target, String text) {
        return WorkflowEdge.builder().id(source + "-" + target).source(source).target(target)
                .condition(new EdgeCondition("content_contains", text)).build();
    }

    public WorkflowEntity workflow(String name, Integer maxRounds, List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        WorkflowEntity workflow = new WorkflowEntity();
        workflow.setName(name);
        workflow.setMaxRounds(maxRounds);
        workflow.setNodes(new ArrayList<>(nodes));
        workflow.setEdges(new ArrayList<>(edges));
        return workflowRepository.save(workflow);
    }

    /**
     * 以工作流当前定义创建并保存运行中的运行
     */
    public WorkflowRunEntity newRun(WorkflowEntity workflow, String input) {
        List<AgentDefinitionEntity> agents = new ArrayList<>(agentRepository.findAll());
        WorkflowRunEntity run = WorkflowRunEntity.create(workflow.getId(), input,
                new WorkflowSnapshot(workflow.toGraph(), agents));
        return runRepository.save(run);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public InMemoryWorkflowRunRepository getRunRepository() {
        return runRepository;
    }

    public InMemoryExecutionLogRepository getLogRepository() {
        return logRepository;
    }

    public InMemoryWorkflowRepository getWorkflowRepository() {
        return workflowRepository;
    }

    public InMemoryAgentDefinitionRepository getAgentRepository() {
        return agentRepository;
    }

    public ScriptedLlmGateway getLlmGateway() {
        return llmGateway;
    }

    public GraphRunnerOptions getOptions() {
        return options;
    }

    public WorkflowGraphRunner getRunner() {
        return runner;
    }
}
