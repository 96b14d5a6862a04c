package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流节点类型枚举
 */
public enum WorkflowNodeTypeEnum {

    /**
     * Agent 节点 - 由大模型驱动，可多轮调用工具
     */
    AGENT("agent"),

    /**
     * 工具节点 - 直接执行一次工具调用
     */
    TOOL("tool"),

    /**
     * 人工节点 - 向用户提问并挂起运行
     */
    WAIT_FOR_USER("wait_for_user");

    private final String code;

    WorkflowNodeTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 兼容画布里的历史类型名，缺省视为 Agent 节点；无法识别时返回 null。
     */
    public static WorkflowNodeTypeEnum fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return AGENT;
        }
        String normalized = code.trim().toLowerCase();
        for (WorkflowNodeTypeEnum type : WorkflowNodeTypeEnum.values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        if ("llm".equals(normalized)) {
            return AGENT;
        }
        return null;
    }
}
