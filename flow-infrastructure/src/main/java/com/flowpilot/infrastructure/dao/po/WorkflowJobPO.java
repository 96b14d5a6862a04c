package com.flowpilot.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 执行队列任务 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowJobPO {

    private Long id;

    /**
     * 任务类型编码
     */
    private String jobType;

    private Long runId;

    /**
     * 状态编码
     */
    private String status;

    /**
     * 载荷 (JSON)
     */
    private String payload;

    private String error;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;
}
