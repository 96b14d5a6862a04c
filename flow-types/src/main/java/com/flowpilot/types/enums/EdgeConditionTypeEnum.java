package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 条件边类型枚举
 */
public enum EdgeConditionTypeEnum {

    /** 输出整体等于给定值，或输出对象的 type 字段等于给定值 */
    MESSAGE_TYPE("message_type"),

    /** 输出文本包含给定值（忽略大小写） */
    CONTENT_CONTAINS("content_contains");

    private final String code;

    EdgeConditionTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EdgeConditionTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EdgeConditionTypeEnum item : EdgeConditionTypeEnum.values()) {
            if (item.code.equals(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown edge condition type code: " + code);
    }
}
