package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流运行状态枚举
 */
public enum RunStatusEnum {

    /**
     * 运行中 - 图正在推进，或已排队等待执行
     */
    RUNNING("running"),

    /**
     * 等待用户 - 某个节点请求人工输入，运行已挂起
     */
    WAITING_FOR_USER("waiting_for_user"),

    /**
     * 已完成
     */
    COMPLETED("completed"),

    /**
     * 失败
     */
    FAILED("failed"),

    /**
     * 已取消
     */
    CANCELLED("cancelled");

    private final String code;

    RunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 状态迁移规则：终态不可再迁移，等待态只能恢复运行或被取消。
     */
    public boolean canTransitionTo(RunStatusEnum target) {
        if (target == null || target == this) {
            return false;
        }
        switch (this) {
            case RUNNING:
                return true;
            case WAITING_FOR_USER:
                return target == RUNNING || target == CANCELLED;
            default:
                return false;
        }
    }

    public static RunStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RunStatusEnum status : RunStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }
}
