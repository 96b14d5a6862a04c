package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 队列任务类型枚举
 */
public enum WorkflowJobTypeEnum {

    /** 从入口节点开始执行 */
    WORKFLOW_START("workflow_start"),

    /** 从恢复游标继续执行 */
    WORKFLOW_RESUME("workflow_resume");

    private final String code;

    WorkflowJobTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static WorkflowJobTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowJobTypeEnum item : WorkflowJobTypeEnum.values()) {
            if (item.code.equals(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown workflow job type code: " + code);
    }
}
