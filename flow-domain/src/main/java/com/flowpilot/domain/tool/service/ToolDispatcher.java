package com.flowpilot.domain.tool.service;

import com.flowpilot.domain.agent.model.valobj.LlmToolSpec;
import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.exception.ToolExecutionException;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 工具分发领域服务：按名称路由到处理器。
 * <p>
 * 未知工具返回 {@code {error: "Unknown tool: name"}}；处理器抛出的异常包装为
 * {@link ToolExecutionException} 后重新抛出。处理器延迟加载，
 * 运行类工具依赖的应用服务可以反过来依赖本服务。
 * </p>
 */
@Slf4j
@Service
public class ToolDispatcher {

    private final Supplier<Collection<IToolHandler>> handlerSource;
    private volatile Map<String, IToolHandler> registry;

    @Autowired
    public ToolDispatcher(ObjectProvider<IToolHandler> handlerProvider) {
        this.handlerSource = () -> handlerProvider.orderedStream().toList();
    }

    public ToolDispatcher(Collection<IToolHandler> handlers) {
        List<IToolHandler> snapshot = handlers == null ? Collections.emptyList() : new ArrayList<>(handlers);
        this.handlerSource = () -> snapshot;
    }

    public Object execute(String toolName, Object args, ToolExecutionContext context) {
        Map<String, Object> safeArgs = normalizeArgs(args);
        ToolExecutionContext safeContext = context == null ? ToolExecutionContext.empty() : context;
        IToolHandler handler = toolName == null ? null : registry().get(toolName);
        if (handler == null) {
            log.warn("Unknown tool requested. toolName={}, runId={}", toolName, safeContext.getRunId());
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", "Unknown tool: " + toolName);
            return error;
        }
        try {
            return handler.execute(toolName, safeArgs, safeContext);
        } catch (RuntimeException ex) {
            log.warn("Tool execution failed. toolName={}, runId={}, nodeId={}, error={}",
                    toolName, safeContext.getRunId(), safeContext.getNodeId(), ex.getMessage());
            throw new ToolExecutionException(toolName, ex);
        }
    }

    public boolean hasTool(String toolName) {
        return toolName != null && registry().containsKey(toolName);
    }

    /**
     * 生成给模型的工具说明，忽略未注册的名称。
     */
    public List<LlmToolSpec> toolSpecs(Collection<String> toolNames) {
        List<LlmToolSpec> specs = new ArrayList<>();
        if (toolNames == null) {
            return specs;
        }
        Map<String, IToolHandler> handlers = registry();
        for (String name : toolNames) {
            IToolHandler handler = handlers.get(name);
            if (handler != null) {
                specs.add(new LlmToolSpec(name, handler.describe(name)));
            }
        }
        return specs;
    }

    private Map<String, IToolHandler> registry() {
        Map<String, IToolHandler> current = registry;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (registry == null) {
                Map<String, IToolHandler> built = new LinkedHashMap<>();
                for (IToolHandler handler : handlerSource.get()) {
                    for (String name : handler.toolNames()) {
                        IToolHandler previous = built.putIfAbsent(name, handler);
                        if (previous != null && previous != handler) {
                            log.warn("Duplicate tool registration ignored. toolName={}, kept={}, ignored={}",
                                    name, previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
                        }
                    }
                }
                registry = Collections.unmodifiableMap(built);
            }
            return registry;
        }
    }

    private Map<String, Object> normalizeArgs(Object args) {
        if (!(args instanceof Map<?, ?> map)) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() != null) {
                copy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return copy;
    }
}
