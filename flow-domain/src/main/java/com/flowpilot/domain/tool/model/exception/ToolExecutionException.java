package com.flowpilot.domain.tool.model.exception;

import lombok.Getter;

/**
 * 工具执行异常，消息格式为 "工具名: 原因"。
 */
@Getter
public class ToolExecutionException extends RuntimeException {

    private static final long serialVersionUID = -4406122683021879516L;

    private final String toolName;

    public ToolExecutionException(String toolName, Throwable cause) {
        super(toolName + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.toolName = toolName;
    }
}
