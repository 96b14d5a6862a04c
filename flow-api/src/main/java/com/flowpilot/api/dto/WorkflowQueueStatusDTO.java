package com.flowpilot.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 执行队列状态 DTO。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowQueueStatusDTO {

    private Integer queued;
    private Integer running;
    private Integer concurrency;
}
