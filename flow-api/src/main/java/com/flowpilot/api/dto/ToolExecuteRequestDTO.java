package com.flowpilot.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 直接调用工具请求 DTO，供规划层使用。
 */
@Data
public class ToolExecuteRequestDTO {

    private Map<String, Object> args;
    private Long runId;
}
