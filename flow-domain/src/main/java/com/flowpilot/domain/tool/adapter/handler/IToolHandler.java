package com.flowpilot.domain.tool.adapter.handler;

import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;

import java.util.Map;
import java.util.Set;

/**
 * 工具处理器。一个处理器可以承载同一族的多个工具。
 * <p>
 * 参数非法时返回 {@code {error: "..."}} 而不是抛异常；抛出的异常由分发器包装后向上传播。
 * </p>
 */
public interface IToolHandler {

    /**
     * 支持的工具名
     */
    Set<String> toolNames();

    /**
     * 工具说明，暴露给模型
     */
    default String describe(String toolName) {
        return toolName;
    }

    Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context);
}
