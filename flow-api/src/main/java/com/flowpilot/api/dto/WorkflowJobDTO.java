package com.flowpilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 队列任务 DTO。
 */
@Data
public class WorkflowJobDTO {

    private Long id;
    private String type;
    private Long runId;
    private String status;
    private Map<String, Object> payload;
    private String error;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
}
