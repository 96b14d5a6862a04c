package com.flowpilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 运行列表项 DTO。
 */
@Data
public class RunSummaryDTO {

    private Long id;
    private Long workflowId;
    private String workflowName;
    private String status;
    private Integer stepCount;
    private Long retryOfRunId;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
}
