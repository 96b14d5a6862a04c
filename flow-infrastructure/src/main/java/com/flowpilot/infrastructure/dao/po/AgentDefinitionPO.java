package com.flowpilot.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent 定义 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDefinitionPO {

    private Long id;

    private String name;

    private String kind;

    private String description;

    private String systemPrompt;

    /**
     * 工具名列表 (JSON 数组)
     */
    private String toolIds;

    private String llmConfigId;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
