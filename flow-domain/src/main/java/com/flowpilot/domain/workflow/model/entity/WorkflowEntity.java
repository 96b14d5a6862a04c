package com.flowpilot.domain.workflow.model.entity;

import com.flowpilot.domain.workflow.model.valobj.WorkflowEdge;
import com.flowpilot.domain.workflow.model.valobj.WorkflowGraph;
import com.flowpilot.domain.workflow.model.valobj.WorkflowNode;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 工作流定义实体
 */
@Data
public class WorkflowEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 名称
     */
    private String name;

    /**
     * 描述
     */
    private String description;

    /**
     * 节点列表 (JSON 存储)
     */
    private List<WorkflowNode> nodes = new ArrayList<>();

    /**
     * 边列表 (JSON 存储)
     */
    private List<WorkflowEdge> edges = new ArrayList<>();

    /**
     * 最大轮次
     */
    private Integer maxRounds;

    /**
     * 每轮附加指令
     */
    private String turnInstruction;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Workflow name cannot be empty");
        }
        if (maxRounds != null && maxRounds <= 0) {
            throw new IllegalStateException("Workflow maxRounds must be positive");
        }
    }

    /**
     * 生成运行期快照，节点与边均为拷贝。
     */
    public WorkflowGraph toGraph() {
        List<WorkflowNode> nodeCopies = new ArrayList<>();
        if (nodes != null) {
            for (WorkflowNode node : nodes) {
                if (node == null) {
                    continue;
                }
                nodeCopies.add(WorkflowNode.builder()
                        .id(node.getId())
                        .type(node.getType())
                        .position(node.getPosition())
                        .parameters(node.getParameters() == null
                                ? new LinkedHashMap<>()
                                : new LinkedHashMap<>(node.getParameters()))
                        .build());
            }
        }
        List<WorkflowEdge> edgeCopies = new ArrayList<>();
        if (edges != null) {
            for (WorkflowEdge edge : edges) {
                if (edge == null) {
                    continue;
                }
                edgeCopies.add(WorkflowEdge.builder()
                        .id(edge.getId())
                        .source(edge.getSource())
                        .target(edge.getTarget())
                        .condition(edge.getCondition())
                        .build());
            }
        }
        return WorkflowGraph.builder()
                .workflowId(id)
                .name(name)
                .nodes(nodeCopies)
                .edges(edgeCopies)
                .maxRounds(maxRounds)
                .turnInstruction(turnInstruction)
                .build();
    }
}
