package com.flowpilot.domain.workflow.model.valobj;

import com.flowpilot.types.enums.WorkflowNodeTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流节点。position 仅供画布使用，执行时忽略。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowNode {

    private String id;

    /** agent / tool / wait_for_user */
    private String type;

    private List<Double> position;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    public WorkflowNodeTypeEnum nodeType() {
        return WorkflowNodeTypeEnum.fromCode(type);
    }

    public Object parameter(String key) {
        return parameters == null ? null : parameters.get(key);
    }
}
