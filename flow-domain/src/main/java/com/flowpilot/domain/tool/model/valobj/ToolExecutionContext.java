package com.flowpilot.domain.tool.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工具调用上下文。规划层直接调用时 runId 等字段为空。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolExecutionContext {

    private Long runId;

    private Long workflowId;

    private String nodeId;

    private Long agentId;

    private int round;

    /** 运行共享上下文快照：最近回合、各节点输出 */
    @Builder.Default
    private Map<String, Object> sharedContext = new LinkedHashMap<>();

    public static ToolExecutionContext empty() {
        return ToolExecutionContext.builder().build();
    }
}
