package com.flowpilot.domain.tool.service.handler;

import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * get_workflow_context：让 Agent 查看当前轮次与最近回合摘要。
 */
@Component
public class WorkflowContextToolHandler implements IToolHandler {

    public static final String GET_WORKFLOW_CONTEXT = "get_workflow_context";

    @Override
    public Set<String> toolNames() {
        return Set.of(GET_WORKFLOW_CONTEXT);
    }

    @Override
    public String describe(String toolName) {
        return "Get the current workflow round and a summary of recent turns by other agents.";
    }

    @Override
    public Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (context == null || context.getRunId() == null) {
            result.put("error", "Not running inside a workflow");
            return result;
        }
        result.put("runId", context.getRunId());
        result.put("workflowId", context.getWorkflowId());
        result.put("nodeId", context.getNodeId());
        result.put("round", context.getRound());
        if (context.getSharedContext() != null) {
            result.putAll(context.getSharedContext());
        }
        return result;
    }
}
