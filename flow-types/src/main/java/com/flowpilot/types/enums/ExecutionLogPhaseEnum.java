package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执行日志阶段枚举
 */
public enum ExecutionLogPhaseEnum {

    /** 节点开始 */
    NODE_START("node_start"),

    /** 节点结束 */
    NODE_DONE("node_done"),

    /** 工具调用 */
    TOOL_CALL("tool_call"),

    /** 工具结果 */
    TOOL_RESULT("tool_result"),

    /** 模型请求 */
    LLM_REQUEST("llm_request"),

    /** 模型响应 */
    LLM_RESPONSE("llm_response"),

    /** 运行状态变化 */
    RUN_STATUS("run_status");

    private final String code;

    ExecutionLogPhaseEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ExecutionLogPhaseEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ExecutionLogPhaseEnum item : ExecutionLogPhaseEnum.values()) {
            if (item.code.equals(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown execution log phase code: " + code);
    }
}
