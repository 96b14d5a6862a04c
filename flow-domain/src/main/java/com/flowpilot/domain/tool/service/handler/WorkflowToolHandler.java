package com.flowpilot.domain.tool.service.handler;

import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.tool.service.ToolArguments;
import com.flowpilot.domain.workflow.adapter.repository.IWorkflowRepository;
import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;
import com.flowpilot.domain.workflow.model.valobj.EdgeCondition;
import com.flowpilot.domain.workflow.model.valobj.WorkflowEdge;
import com.flowpilot.domain.workflow.model.valobj.WorkflowNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flowpilot.domain.tool.service.ToolArguments.error;
import static com.flowpilot.domain.tool.service.ToolArguments.has;
import static com.flowpilot.domain.tool.service.ToolArguments.intValue;
import static com.flowpilot.domain.tool.service.ToolArguments.longValue;
import static com.flowpilot.domain.tool.service.ToolArguments.string;

/**
 * 工作流管理工具：list / get / create / update / add_workflow_edges / delete。
 * <p>
 * 边兼容 source/target、from/to、sourceId/targetId 三种写法；
 * update_workflow 同时接受平铺参数与嵌套的 workflow 对象。
 * </p>
 */
@Slf4j
@Component
public class WorkflowToolHandler implements IToolHandler {

    private final IWorkflowRepository workflowRepository;

    public WorkflowToolHandler(IWorkflowRepository workflowRepository) {
        this.workflowRepository = workflowRepository;
    }

    @Override
    public Set<String> toolNames() {
        return Set.of("list_workflows", "get_workflow", "create_workflow", "update_workflow",
                "add_workflow_edges", "delete_workflow");
    }

    @Override
    public String describe(String toolName) {
        switch (toolName) {
            case "create_workflow":
                return "Create a workflow. Args: name, description?, nodes?, edges?, maxRounds?, turnInstruction?";
            case "update_workflow":
                return "Replace parts of a workflow. Args: id, name?, nodes?, edges?, maxRounds?, turnInstruction?";
            case "add_workflow_edges":
                return "Merge nodes and edges into a workflow. Args: id, nodes?, edges (source, target, condition?)";
            case "get_workflow":
                return "Get a workflow by id or name. Args: id | name";
            case "delete_workflow":
                return "Delete a workflow. Args: id";
            default:
                return "List all workflows.";
        }
    }

    @Override
    public Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context) {
        switch (toolName) {
            case "list_workflows":
                return listWorkflows();
            case "get_workflow":
                return getWorkflow(args);
            case "create_workflow":
                return createWorkflow(args);
            case "update_workflow":
                return updateWorkflow(flatten(args));
            case "add_workflow_edges":
                return addWorkflowEdges(args);
            default:
                return deleteWorkflow(args);
        }
    }

    private Map<String, Object> listWorkflows() {
        List<Map<String, Object>> items = new ArrayList<>();
        for (WorkflowEntity workflow : workflowRepository.findAll()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", workflow.getId());
            item.put("name", workflow.getName());
            item.put("description", workflow.getDescription());
            item.put("nodes", workflow.getNodes() == null ? 0 : workflow.getNodes().size());
            items.add(item);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("workflows", items);
        return result;
    }

    private Map<String, Object> getWorkflow(Map<String, Object> args) {
        WorkflowEntity workflow = resolveWorkflow(args);
        return workflow == null ? error("Workflow not found") : toView(workflow);
    }

    private Map<String, Object> createWorkflow(Map<String, Object> args) {
        String name = string(args, "name");
        if (name == null) {
            return error("name is required");
        }
        WorkflowEntity workflow = new WorkflowEntity();
        workflow.setName(name);
        workflow.setDescription(string(args, "description"));
        workflow.setNodes(parseNodes(ToolArguments.list(args, "nodes")));
        workflow.setEdges(parseEdges(ToolArguments.list(args, "edges")));
        Integer maxRounds = intValue(args, "maxRounds");
        if (maxRounds != null && maxRounds > 0) {
            workflow.setMaxRounds(maxRounds);
        }
        workflow.setTurnInstruction(string(args, "turnInstruction"));
        workflow.setCreatedAt(LocalDateTime.now());
        workflow.setUpdatedAt(LocalDateTime.now());
        WorkflowEntity saved = workflowRepository.save(workflow);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", saved.getId());
        result.put("name", saved.getName());
        result.put("message", "Workflow \"" + saved.getName() + "\" created");
        return result;
    }

    private Map<String, Object> updateWorkflow(Map<String, Object> args) {
        WorkflowEntity workflow = resolveWorkflow(args);
        if (workflow == null) {
            return error("Workflow not found");
        }
        if (longValue(args, "id", "workflowId") != null && string(args, "name") != null) {
            workflow.setName(string(args, "name"));
        }
        if (has(args, "description")) {
            workflow.setDescription(string(args, "description"));
        }
        if (args.get("nodes") instanceof List<?>) {
            workflow.setNodes(parseNodes(ToolArguments.list(args, "nodes")));
        }
        if (args.get("edges") instanceof List<?>) {
            workflow.setEdges(parseEdges(ToolArguments.list(args, "edges")));
        }
        applyRoundSettings(workflow, args);
        workflow.setUpdatedAt(LocalDateTime.now());
        WorkflowEntity updated = workflowRepository.update(workflow);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", updated.getId());
        result.put("message", "Workflow \"" + updated.getName() + "\" updated");
        result.put("nodes", updated.getNodes().size());
        result.put("edges", updated.getEdges().size());
        return result;
    }

    private Map<String, Object> addWorkflowEdges(Map<String, Object> args) {
        WorkflowEntity workflow = resolveWorkflow(args);
        if (workflow == null) {
            return error("Workflow not found");
        }
        List<WorkflowNode> nodes = new ArrayList<>(workflow.getNodes() == null ? List.of() : workflow.getNodes());
        Set<String> nodeIds = new HashSet<>();
        nodes.forEach(node -> nodeIds.add(node.getId()));
        for (WorkflowNode node : parseNodes(ToolArguments.list(args, "nodes"))) {
            if (nodeIds.add(node.getId())) {
                nodes.add(node);
            }
        }
        List<WorkflowEdge> edges = new ArrayList<>(workflow.getEdges() == null ? List.of() : workflow.getEdges());
        Set<String> edgeIds = new HashSet<>();
        edges.forEach(edge -> edgeIds.add(edge.getId()));
        List<WorkflowEdge> incoming = parseEdges(ToolArguments.list(args, "edges"));
        for (WorkflowEdge edge : incoming) {
            if (edgeIds.add(edge.getId())) {
                edges.add(edge);
            }
        }
        workflow.setNodes(nodes);
        workflow.setEdges(edges);
        applyRoundSettings(workflow, args);
        workflow.setUpdatedAt(LocalDateTime.now());
        WorkflowEntity updated = workflowRepository.update(workflow);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", updated.getId());
        result.put("message", "Added " + incoming.size() + " edge(s) to workflow");
        result.put("nodes", nodes.size());
        result.put("edges", edges.size());
        return result;
    }

    private Map<String, Object> deleteWorkflow(Map<String, Object> args) {
        Long id = longValue(args, "id", "workflowId");
        if (id == null) {
            return error("id is required");
        }
        if (!workflowRepository.deleteById(id)) {
            return error("Workflow not found");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", id);
        result.put("message", "Workflow deleted");
        return result;
    }

    private void applyRoundSettings(WorkflowEntity workflow, Map<String, Object> args) {
        Integer maxRounds = intValue(args, "maxRounds");
        if (maxRounds != null && maxRounds > 0) {
            workflow.setMaxRounds(maxRounds);
        }
        if (has(args, "turnInstruction")) {
            workflow.setTurnInstruction(string(args, "turnInstruction"));
        }
    }

    private Map<String, Object> flatten(Map<String, Object> args) {
        Map<String, Object> nested = ToolArguments.map(args.get("workflow"));
        if (nested == null) {
            return args;
        }
        Map<String, Object> merged = new LinkedHashMap<>(args);
        for (String key : List.of("nodes", "edges", "maxRounds", "name", "description", "turnInstruction")) {
            if (!merged.containsKey(key) && nested.containsKey(key)) {
                merged.put(key, nested.get(key));
            }
        }
        return merged;
    }

    private WorkflowEntity resolveWorkflow(Map<String, Object> args) {
        Long id = longValue(args, "id", "workflowId");
        if (id != null) {
            return workflowRepository.findById(id);
        }
        String name = string(args, "name", "workflowName");
        return name == null ? null : workflowRepository.findByName(name);
    }

    private List<WorkflowNode> parseNodes(List<Object> raw) {
        List<WorkflowNode> nodes = new ArrayList<>();
        for (Object item : raw) {
            Map<String, Object> node = ToolArguments.map(item);
            String id = node == null ? null : string(node, "id");
            if (id == null) {
                continue;
            }
            Map<String, Object> parameters = ToolArguments.map(node.get("parameters"));
            if (parameters == null) {
                parameters = new LinkedHashMap<>();
            }
            // 允许把 agentId / toolName 等直接写在节点上
            for (String key : List.of("agentId", "agentName", "toolName", "arguments", "question")) {
                if (!parameters.containsKey(key) && node.containsKey(key)) {
                    parameters.put(key, node.get(key));
                }
            }
            nodes.add(WorkflowNode.builder()
                    .id(id)
                    .type(StringUtils.defaultIfBlank(string(node, "type"), "agent"))
                    .parameters(parameters)
                    .build());
        }
        return nodes;
    }

    private List<WorkflowEdge> parseEdges(List<Object> raw) {
        List<WorkflowEdge> edges = new ArrayList<>();
        for (Object item : raw) {
            Map<String, Object> edge = ToolArguments.map(item);
            if (edge == null) {
                continue;
            }
            String source = string(edge, "source", "from", "sourceId");
            String target = string(edge, "target", "to", "targetId");
            if (source == null || target == null) {
                continue;
            }
            String id = StringUtils.defaultIfBlank(string(edge, "id"), "e-" + source + "-" + target);
            EdgeCondition condition = null;
            Map<String, Object> rawCondition = ToolArguments.map(edge.get("condition"));
            if (rawCondition != null && string(rawCondition, "type") != null) {
                condition = new EdgeCondition(string(rawCondition, "type"), string(rawCondition, "value"));
            }
            edges.add(WorkflowEdge.builder().id(id).source(source).target(target).condition(condition).build());
        }
        return edges;
    }

    private Map<String, Object> toView(WorkflowEntity workflow) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", workflow.getId());
        view.put("name", workflow.getName());
        view.put("description", workflow.getDescription());
        view.put("nodes", workflow.getNodes());
        view.put("edges", workflow.getEdges());
        view.put("maxRounds", workflow.getMaxRounds());
        view.put("turnInstruction", workflow.getTurnInstruction());
        return view;
    }
}
