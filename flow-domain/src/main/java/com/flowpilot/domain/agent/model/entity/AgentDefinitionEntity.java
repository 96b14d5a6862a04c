package com.flowpilot.domain.agent.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Agent 定义实体
 */
@Data
public class AgentDefinitionEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 名称 (工作流节点可按名称引用)
     */
    private String name;

    /**
     * 类型，目前只有 llm
     */
    private String kind;

    /**
     * 描述
     */
    private String description;

    /**
     * 系统提示词
     */
    private String systemPrompt;

    /**
     * 可用工具名列表
     */
    private List<String> toolIds = new ArrayList<>();

    /**
     * 模型配置 ID (可空，空则使用默认模型)
     */
    private String llmConfigId;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Agent name cannot be empty");
        }
    }
}
