package com.flowpilot.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 轨迹步骤 DTO。
 */
@Data
public class TrailStepDTO {

    private Integer order;
    private Integer round;
    private String nodeId;
    private String nodeType;
    private Long agentId;
    private String agentName;
    private Object input;
    private Object output;
    private List<Map<String, Object>> toolCalls;
    private Boolean inputIsUserReply;
    private String sentToNodeId;
    private String sentToAgentName;
    private String error;
    private Boolean waitingForUser;
}
