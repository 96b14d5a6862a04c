package com.flowpilot.domain.run.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.domain.agent.adapter.gateway.ILlmGateway;
import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.agent.model.valobj.LlmMessage;
import com.flowpilot.domain.agent.model.valobj.LlmRequest;
import com.flowpilot.domain.agent.model.valobj.LlmResponse;
import com.flowpilot.domain.agent.model.valobj.LlmToolCall;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.model.valobj.GraphRunnerOptions;
import com.flowpilot.domain.run.model.valobj.NodeTurnResult;
import com.flowpilot.domain.run.model.valobj.PendingRequest;
import com.flowpilot.domain.run.model.valobj.PendingVisit;
import com.flowpilot.domain.run.model.valobj.ResumeCursor;
import com.flowpilot.domain.run.model.valobj.ToolCallSummary;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.tool.service.ToolArguments;
import com.flowpilot.domain.tool.service.ToolDispatcher;
import com.flowpilot.domain.tool.service.ToolOutcomeClassifier;
import com.flowpilot.domain.tool.service.ToolReferenceResolver;
import com.flowpilot.domain.workflow.model.valobj.WorkflowGraph;
import com.flowpilot.domain.workflow.model.valobj.WorkflowNode;
import com.flowpilot.types.common.Constants;
import com.flowpilot.types.enums.ExecutionLogPhaseEnum;
import com.flowpilot.types.enums.WorkflowNodeTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 节点回合执行：Agent 节点的模型-工具循环、工具节点的单次调用、人工节点的挂起请求。
 * <p>
 * 每次工具调用依次经过引用解析、分发、结果分类，工具结果写入游标的工具历史，
 * 供后续调用的 {{toolName.path}} 引用。回合内需要用户输入时立即返回等待结果。
 * </p>
 */
@Slf4j
@Service
public class NodeTurnExecutor {

    /** 每个 Agent 都可使用的内置工具 */
    static final List<String> BUILTIN_AGENT_TOOLS =
            List.of("ask_user", "request_user_help", "format_response", "get_workflow_context");

    private static final int SUMMARY_MAX = 200;

    private final ILlmGateway llmGateway;
    private final ToolDispatcher toolDispatcher;
    private final ToolReferenceResolver referenceResolver;
    private final ToolOutcomeClassifier outcomeClassifier;
    private final ExecutionLogRecorder logRecorder;
    private final ObjectMapper objectMapper;

    public NodeTurnExecutor(ILlmGateway llmGateway,
                            ToolDispatcher toolDispatcher,
                            ToolReferenceResolver referenceResolver,
                            ToolOutcomeClassifier outcomeClassifier,
                            ExecutionLogRecorder logRecorder,
                            ObjectMapper objectMapper) {
        this.llmGateway = llmGateway;
        this.toolDispatcher = toolDispatcher;
        this.referenceResolver = referenceResolver;
        this.outcomeClassifier = outcomeClassifier;
        this.logRecorder = logRecorder;
        this.objectMapper = objectMapper;
    }

    public NodeTurnResult execute(WorkflowRunEntity run, WorkflowNode node, PendingVisit visit,
                                  int maxRounds, GraphRunnerOptions options) {
        WorkflowNodeTypeEnum type = node.nodeType();
        if (type == null) {
            throw new IllegalStateException("Unknown node type: " + node.getType() + " (node " + node.getId() + ")");
        }
        switch (type) {
            case TOOL:
                return executeToolNode(run, node, visit, maxRounds, options);
            case WAIT_FOR_USER:
                return executeWaitNode(node, visit);
            default:
                return executeAgentNode(run, node, visit, maxRounds, options);
        }
    }

    private NodeTurnResult executeAgentNode(WorkflowRunEntity run, WorkflowNode node, PendingVisit visit,
                                            int maxRounds, GraphRunnerOptions options) {
        WorkflowGraph graph = run.getSnapshot().getGraph();
        AgentDefinitionEntity agent = run.getSnapshot().findAgent(node.parameter("agentId"), node.parameter("agentName"));
        if (agent == null) {
            throw new IllegalStateException("Agent not found for node " + node.getId());
        }
        ResumeCursor cursor = run.getCursor();
        ToolExecutionContext context = buildContext(run, node, visit, agent.getId(), maxRounds);

        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.user(buildUserMessage(graph, visit)));
        Set<String> toolNames = new LinkedHashSet<>();
        if (agent.getToolIds() != null) {
            toolNames.addAll(agent.getToolIds());
        }
        toolNames.addAll(BUILTIN_AGENT_TOOLS);
        LlmRequest request = LlmRequest.builder()
                .llmConfigId(agent.getLlmConfigId())
                .systemPrompt(buildSystemPrompt(agent, graph, visit.getRound(), maxRounds))
                .messages(messages)
                .tools(toolDispatcher.toolSpecs(toolNames))
                .build();

        List<ToolCallSummary> summaries = new ArrayList<>();
        String content = null;
        int iterations = Math.max(options.getMaxToolIterations(), 1);
        for (int i = 0; i < iterations; i++) {
            logRecorder.record(run.getId(), ExecutionLogPhaseEnum.LLM_REQUEST, agent.getName(), request.getMessages());
            LlmResponse response = llmGateway.call(request);
            logRecorder.record(run.getId(), ExecutionLogPhaseEnum.LLM_RESPONSE, agent.getName(), response);
            content = response == null ? null : response.getContent();
            if (response == null || !response.hasToolCalls()) {
                return agentResult(agent, content, summaries, null);
            }
            if (StringUtils.isNotBlank(content)) {
                messages.add(LlmMessage.assistant(content));
            }
            for (LlmToolCall call : response.getToolCalls()) {
                Object result = invokeTool(run, cursor, call.getName(), call.getArguments(), context, summaries);
                if (outcomeClassifier.isWaitingForInput(call.getName(), result)) {
                    PendingRequest pending = outcomeClassifier.extractPendingRequest(call.getName(), result);
                    NodeTurnResult waiting = agentResult(agent, content, summaries, null);
                    waiting.setWaiting(true);
                    waiting.setPendingRequest(pending);
                    return waiting;
                }
                messages.add(LlmMessage.tool("Result of " + call.getName() + ": " + toText(result)));
            }
        }
        log.warn("Tool iteration limit reached. runId={}, nodeId={}, agent={}, iterations={}",
                run.getId(), node.getId(), agent.getName(), iterations);
        return agentResult(agent, content, summaries, "Tool iteration limit reached");
    }

    private NodeTurnResult executeToolNode(WorkflowRunEntity run, WorkflowNode node, PendingVisit visit,
                                           int maxRounds, GraphRunnerOptions options) {
        String toolName = StringUtils.defaultIfBlank(stringParam(node, "toolName"), stringParam(node, "toolId"));
        if (toolName == null) {
            throw new IllegalStateException("Tool node " + node.getId() + " has no toolName");
        }
        Map<String, Object> configured = ToolArguments.map(node.parameter("arguments"));
        Map<String, Object> args = configured == null ? new LinkedHashMap<>() : configured;
        if (!args.containsKey("_input") && visit.getInput() != null) {
            args.put("_input", visit.getInput());
        }
        ToolExecutionContext context = buildContext(run, node, visit, null, maxRounds);
        List<ToolCallSummary> summaries = new ArrayList<>();
        Object result = invokeTool(run, run.getCursor(), toolName, args, context, summaries);
        NodeTurnResult turn = NodeTurnResult.builder()
                .output(result)
                .toolCalls(summaries)
                .error(outcomeClassifier.failureMessage(result))
                .build();
        if (outcomeClassifier.isWaitingForInput(toolName, result)) {
            turn.setWaiting(true);
            turn.setPendingRequest(outcomeClassifier.extractPendingRequest(toolName, result));
        }
        return turn;
    }

    private NodeTurnResult executeWaitNode(WorkflowNode node, PendingVisit visit) {
        String question = StringUtils.defaultIfBlank(stringParam(node, "question"), stringParam(node, "message"));
        PendingRequest request = PendingRequest.builder()
                .question(StringUtils.defaultIfBlank(question, Constants.DEFAULT_WAIT_QUESTION))
                .options(ToolArguments.stringList(node.getParameters(), "options"))
                .reason(stringParam(node, "reason"))
                .build();
        return NodeTurnResult.builder()
                .output(visit.getInput())
                .waiting(true)
                .pendingRequest(request)
                .build();
    }

    private Object invokeTool(WorkflowRunEntity run, ResumeCursor cursor, String toolName, Map<String, Object> rawArgs,
                              ToolExecutionContext context, List<ToolCallSummary> summaries) {
        Map<String, Object> args = referenceResolver.resolveArgs(rawArgs, cursor.getToolResults());
        logRecorder.record(run.getId(), ExecutionLogPhaseEnum.TOOL_CALL, toolName, args);
        Object result = toolDispatcher.execute(toolName, args, context);
        cursor.addToolResult(toolName, result);
        logRecorder.record(run.getId(), ExecutionLogPhaseEnum.TOOL_RESULT, toolName, result);
        boolean failed = outcomeClassifier.isFailure(result);
        summaries.add(ToolCallSummary.builder()
                .name(toolName)
                .argsSummary(StringUtils.abbreviate(toText(args), SUMMARY_MAX))
                .resultSummary(failed ? outcomeClassifier.failureMessage(result)
                        : StringUtils.abbreviate(toText(result), SUMMARY_MAX))
                .failed(failed)
                .build());
        if (failed) {
            log.info("Tool returned failure. runId={}, nodeId={}, toolName={}, error={}",
                    run.getId(), context.getNodeId(), toolName, outcomeClassifier.failureMessage(result));
        }
        return result;
    }

    private ToolExecutionContext buildContext(WorkflowRunEntity run, WorkflowNode node, PendingVisit visit,
                                              Long agentId, int maxRounds) {
        ResumeCursor cursor = run.getCursor();
        Map<String, Object> shared = new LinkedHashMap<>();
        shared.put("maxRounds", maxRounds);
        shared.put("recentTurns", new ArrayList<>(cursor.getRecentTurns()));
        shared.put("nodeOutputs", new LinkedHashMap<>(cursor.getNodeOutputs()));
        return ToolExecutionContext.builder()
                .runId(run.getId())
                .workflowId(run.getWorkflowId())
                .nodeId(node.getId())
                .agentId(agentId)
                .round(visit.getRound())
                .sharedContext(shared)
                .build();
    }

    private String buildUserMessage(WorkflowGraph graph, PendingVisit visit) {
        String text = toText(visit.getInput());
        if (visit.isInputIsUserReply()) {
            return "The user has replied to your previous request. Their reply: \"" + text
                    + "\". Proceed based on this reply; do not ask the same question again.";
        }
        if (visit.getFromNodeId() != null) {
            return "Message from " + sourceLabel(graph, visit.getFromNodeId()) + ":\n" + text;
        }
        return StringUtils.defaultIfBlank(text, "Begin.");
    }

    private String buildSystemPrompt(AgentDefinitionEntity agent, WorkflowGraph graph, int round, int maxRounds) {
        StringBuilder prompt = new StringBuilder(StringUtils.defaultString(agent.getSystemPrompt()));
        if (StringUtils.isNotBlank(graph.getTurnInstruction())) {
            prompt.append("\n\n").append(graph.getTurnInstruction().trim());
        }
        prompt.append("\n\nWorkflow round ").append(round + 1).append(" of ").append(maxRounds).append('.');
        return prompt.toString();
    }

    private String sourceLabel(WorkflowGraph graph, String nodeId) {
        WorkflowNode source = graph.findNode(nodeId);
        if (source == null) {
            return nodeId;
        }
        Object agentName = source.parameter("agentName");
        return agentName == null ? nodeId : String.valueOf(agentName);
    }

    private NodeTurnResult agentResult(AgentDefinitionEntity agent, String content,
                                       List<ToolCallSummary> summaries, String error) {
        return NodeTurnResult.builder()
                .output(StringUtils.defaultString(content))
                .toolCalls(summaries)
                .error(error)
                .agentId(agent.getId())
                .agentName(agent.getName())
                .build();
    }

    private String stringParam(WorkflowNode node, String key) {
        Object value = node.parameter(key);
        return value == null || StringUtils.isBlank(String.valueOf(value)) ? null : String.valueOf(value).trim();
    }

    String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }
}
