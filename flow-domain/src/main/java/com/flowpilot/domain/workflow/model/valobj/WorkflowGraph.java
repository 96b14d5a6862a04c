package com.flowpilot.domain.workflow.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 运行期工作流图快照。
 * <p>
 * 没有任何边时，节点按声明顺序串联；入口节点为没有入边的节点，
 * 若所有节点都有入边（纯环），取第一个节点为入口。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowGraph {

    private Long workflowId;

    private String name;

    @Builder.Default
    private List<WorkflowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<WorkflowEdge> edges = new ArrayList<>();

    /** 最大轮次，空表示使用全局默认值 */
    private Integer maxRounds;

    /** 每轮附加给 Agent 的指令 */
    private String turnInstruction;

    public WorkflowNode findNode(String nodeId) {
        if (nodeId == null || nodes == null) {
            return null;
        }
        for (WorkflowNode node : nodes) {
            if (node != null && nodeId.equals(node.getId())) {
                return node;
            }
        }
        return null;
    }

    /**
     * 执行时实际使用的边：显式边，或无边时按节点顺序生成的串联边。
     */
    public List<WorkflowEdge> effectiveEdges() {
        if (edges != null && !edges.isEmpty()) {
            return edges;
        }
        List<WorkflowEdge> chain = new ArrayList<>();
        if (nodes == null) {
            return chain;
        }
        for (int i = 0; i + 1 < nodes.size(); i++) {
            String from = nodes.get(i).getId();
            String to = nodes.get(i + 1).getId();
            chain.add(WorkflowEdge.builder().id("chain-" + from + "-" + to).source(from).target(to).build());
        }
        return chain;
    }

    public List<WorkflowEdge> outgoingEdges(String nodeId) {
        List<WorkflowEdge> result = new ArrayList<>();
        for (WorkflowEdge edge : effectiveEdges()) {
            if (edge != null && nodeId != null && nodeId.equals(edge.getSource())) {
                result.add(edge);
            }
        }
        return result;
    }

    public List<String> entryNodeIds() {
        List<String> result = new ArrayList<>();
        if (nodes == null || nodes.isEmpty()) {
            return result;
        }
        Set<String> targets = new HashSet<>();
        for (WorkflowEdge edge : effectiveEdges()) {
            if (edge != null && edge.getTarget() != null && findNode(edge.getSource()) != null) {
                targets.add(edge.getTarget());
            }
        }
        for (WorkflowNode node : nodes) {
            if (node != null && node.getId() != null && !targets.contains(node.getId())) {
                result.add(node.getId());
            }
        }
        if (result.isEmpty()) {
            result.add(nodes.get(0).getId());
        }
        return result;
    }

    public boolean isEntryNode(String nodeId) {
        return entryNodeIds().contains(nodeId);
    }

    /**
     * 配置校验：空图、空 ID、重复 ID 与起点不存在的边。
     * 终点不存在的边不在此处报错，执行到时记入步骤。
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (nodes == null || nodes.isEmpty()) {
            errors.add("Workflow has no nodes");
            return errors;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (WorkflowNode node : nodes) {
            if (node == null || node.getId() == null || node.getId().trim().isEmpty()) {
                errors.add("Workflow node without id");
                continue;
            }
            if (!seen.add(node.getId())) {
                errors.add("Duplicate node id: " + node.getId());
            }
        }
        if (edges != null) {
            for (WorkflowEdge edge : edges) {
                if (edge != null && findNode(edge.getSource()) == null) {
                    errors.add("Edge " + edge.getId() + " starts at missing node " + edge.getSource());
                }
            }
        }
        return errors;
    }
}
