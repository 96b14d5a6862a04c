package com.flowpilot.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 运行不存在 */
    RUN_NOT_FOUND("1001", "运行不存在"),

    /** 运行未处于等待用户输入状态 */
    RUN_NOT_PENDING("1002", "运行未等待用户输入"),

    /** 运行已结束，无法取消 */
    RUN_NOT_CANCELLABLE("1003", "运行无法取消"),

    /** 仅失败的运行可以重试 */
    RUN_NOT_RETRYABLE("1004", "运行无法重试"),

    /** 自修复重试次数已用尽 */
    RETRY_LIMIT_EXCEEDED("1005", "重试次数已达上限"),

    /** 工作流不存在 */
    WORKFLOW_NOT_FOUND("1006", "工作流不存在"),

    /** 工作流配置错误 */
    WORKFLOW_CONFIG_ERROR("1007", "工作流配置错误"),

    /** 未配置大模型 */
    LLM_UNAVAILABLE("1008", "大模型不可用"),

    /** 任务不存在 */
    JOB_NOT_FOUND("1009", "队列任务不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
