package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 队列任务状态枚举
 */
public enum WorkflowJobStatusEnum {

    /** 排队中 */
    QUEUED("queued"),

    /** 执行中 */
    RUNNING("running"),

    /** 已完成 */
    COMPLETED("completed"),

    /** 失败 */
    FAILED("failed");

    private final String code;

    WorkflowJobStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static WorkflowJobStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowJobStatusEnum item : WorkflowJobStatusEnum.values()) {
            if (item.code.equals(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown workflow job status code: " + code);
    }
}
