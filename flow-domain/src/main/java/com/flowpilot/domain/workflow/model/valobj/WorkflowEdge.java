package com.flowpilot.domain.workflow.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工作流有向边
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowEdge {

    private String id;

    private String source;

    private String target;

    /** 可空，空表示无条件边 */
    private EdgeCondition condition;

    public boolean matches(Object output, String content) {
        return condition == null || condition.matches(output, content);
    }
}
