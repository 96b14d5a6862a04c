package com.flowpilot.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作流定义 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowPO {

    private Long id;

    private String name;

    private String description;

    /**
     * 节点 (JSON 数组)
     */
    private String nodes;

    /**
     * 边 (JSON 数组)
     */
    private String edges;

    private Integer maxRounds;

    private String turnInstruction;

    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
