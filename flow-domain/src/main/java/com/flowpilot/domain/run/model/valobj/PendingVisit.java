package com.flowpilot.domain.run.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 待执行的节点访问
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingVisit {

    private String nodeId;

    private Object input;

    private int round;

    /** 上游节点，入口节点为空 */
    private String fromNodeId;

    private boolean inputIsUserReply;
}
