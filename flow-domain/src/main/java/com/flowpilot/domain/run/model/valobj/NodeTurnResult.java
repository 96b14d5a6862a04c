package com.flowpilot.domain.run.model.valobj;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个节点回合的执行结果
 */
@Data
@Builder
public class NodeTurnResult {

    private Object output;

    private boolean waiting;

    private PendingRequest pendingRequest;

    @Builder.Default
    private List<ToolCallSummary> toolCalls = new ArrayList<>();

    private String error;

    private Long agentId;

    private String agentName;
}
