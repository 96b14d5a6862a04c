package com.flowpilot.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 运行调试日志 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLogPO {

    private Long id;

    private Long runId;

    private Integer seqNo;

    private String phase;

    private String label;

    private String payload;

    private LocalDateTime createdAt;
}
