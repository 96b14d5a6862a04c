package com.flowpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 恢复方式：挂起节点收到用户回复后如何继续
 */
public enum ResumeNodeModeEnum {

    /** 以回复为输入重新执行挂起节点（Agent 节点） */
    RERUN_NODE("rerun_node"),

    /** 回复作为挂起节点的输出，直接调度后继（工具节点、等待节点） */
    SUCCESSORS("successors");

    private final String code;

    ResumeNodeModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ResumeNodeModeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ResumeNodeModeEnum item : ResumeNodeModeEnum.values()) {
            if (item.code.equals(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown resume node mode code: " + code);
    }

    public static ResumeNodeModeEnum forNodeType(WorkflowNodeTypeEnum nodeType) {
        return nodeType == WorkflowNodeTypeEnum.AGENT ? RERUN_NODE : SUCCESSORS;
    }
}
