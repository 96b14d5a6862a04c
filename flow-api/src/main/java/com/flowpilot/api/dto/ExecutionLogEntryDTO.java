package com.flowpilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 运行调试日志 DTO。
 */
@Data
public class ExecutionLogEntryDTO {

    private Integer sequence;
    private String phase;
    private String label;
    private String payload;
    private LocalDateTime createdAt;
}
