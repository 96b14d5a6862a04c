package com.flowpilot.domain.run.model.entity;

import com.flowpilot.types.enums.ExecutionLogPhaseEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 运行调试日志实体
 */
@Data
public class ExecutionLogEntity {

    private Long id;

    private Long runId;

    /**
     * 运行内递增序号，从 1 开始
     */
    private Integer sequence;

    private ExecutionLogPhaseEnum phase;

    private String label;

    /**
     * JSON 载荷，超长截断
     */
    private String payload;

    private LocalDateTime createdAt;
}
