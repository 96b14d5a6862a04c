package com.flowpilot.domain.run.model.valobj;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 轨迹步骤，一个节点回合对应一条，写入后不再修改。
 */
@Value
@Builder
@Jacksonized
public class TrailStep {

    /** 从 0 开始的顺序号 */
    int order;

    int round;

    String nodeId;

    String nodeType;

    Long agentId;

    String agentName;

    Object input;

    Object output;

    List<ToolCallSummary> toolCalls;

    /** 输入来自用户对挂起请求的回复 */
    boolean inputIsUserReply;

    /** 输出交给的第一个后继节点 */
    String sentToNodeId;

    String sentToAgentName;

    /** 配置错误或工具失败说明 */
    String error;

    boolean waitingForUser;
}
