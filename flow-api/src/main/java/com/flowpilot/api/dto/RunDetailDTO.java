package com.flowpilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 运行详情 DTO。
 */
@Data
public class RunDetailDTO {

    private Long id;
    private Long workflowId;
    private String status;
    private String initialInput;
    private Map<String, Object> output;
    private List<TrailStepDTO> trail;
    private Map<String, Object> pendingRequest;
    private Long retryOfRunId;
    private Integer retryAttempt;
    private Boolean cancelRequested;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
