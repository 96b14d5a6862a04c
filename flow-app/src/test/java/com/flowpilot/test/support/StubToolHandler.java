package com.flowpilot.test.support;

import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 单个工具的桩实现，记录每次收到的参数。
 */
public class StubToolHandler implements IToolHandler {

    private final String toolName;
    private final Function<Map<String, Object>, Object> behavior;
    private final List<Map<String, Object>> invocations = new ArrayList<>();

    public StubToolHandler(String toolName, Function<Map<String, Object>, Object> behavior) {
        this.toolName = toolName;
        this.behavior = behavior;
    }

    @Override
    public Set<String> toolNames() {
        return Set.of(toolName);
    }

    @Override
    public Object execute(String name, Map<String, Object> args, ToolExecutionContext context) {
        invocations.add(args);
        return behavior.apply(args);
    }

    public List<Map<String, Object>> getInvocations() {
        return invocations;
    }
}
