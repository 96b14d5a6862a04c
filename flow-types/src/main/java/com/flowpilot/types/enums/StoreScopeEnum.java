package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent 存储作用域
 */
public enum StoreScopeEnum {

    /** 按 Agent 隔离 */
    AGENT("agent"),

    /** 按改进任务隔离 */
    JOB("job");

    private final String code;

    StoreScopeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static StoreScopeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (StoreScopeEnum item : StoreScopeEnum.values()) {
            if (item.code.equals(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown store scope code: " + code);
    }
}
