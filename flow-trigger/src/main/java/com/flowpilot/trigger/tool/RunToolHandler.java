package com.flowpilot.trigger.tool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.api.dto.RunDetailDTO;
import com.flowpilot.api.dto.RunSummaryDTO;
import com.flowpilot.api.dto.TrailStepDTO;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.model.valobj.WorkflowSnapshot;
import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.workflow.adapter.repository.IWorkflowRepository;
import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;
import com.flowpilot.trigger.application.command.WorkflowRunCommandService;
import com.flowpilot.trigger.application.query.WorkflowRunQueryService;
import com.flowpilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flowpilot.domain.tool.service.ToolArguments.error;
import static com.flowpilot.domain.tool.service.ToolArguments.longValue;
import static com.flowpilot.domain.tool.service.ToolArguments.string;

/**
 * 运行管理工具：执行、查询、回复、取消与自修复重试。业务异常转换为 {error}。
 */
@Slf4j
@Component
public class RunToolHandler implements IToolHandler {

    private static final int LIST_LIMIT = 20;

    private final WorkflowRunCommandService workflowRunCommandService;
    private final WorkflowRunQueryService workflowRunQueryService;
    private final IWorkflowRepository workflowRepository;
    private final ObjectMapper objectMapper;

    public RunToolHandler(WorkflowRunCommandService workflowRunCommandService,
                          WorkflowRunQueryService workflowRunQueryService,
                          IWorkflowRepository workflowRepository,
                          ObjectMapper objectMapper) {
        this.workflowRunCommandService = workflowRunCommandService;
        this.workflowRunQueryService = workflowRunQueryService;
        this.workflowRepository = workflowRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Set<String> toolNames() {
        return Set.of("execute_workflow", "list_runs", "get_run", "respond_to_run", "cancel_run",
                "get_run_for_improvement", "retry_run");
    }

    @Override
    public String describe(String toolName) {
        switch (toolName) {
            case "execute_workflow":
                return "Run a workflow to completion or until it waits for input. Args: workflowId | name, input?";
            case "list_runs":
                return "List the 20 most recent runs.";
            case "get_run":
                return "Get a run with its trail. Args: runId";
            case "respond_to_run":
                return "Answer a run that is waiting for user input. Args: runId, response";
            case "cancel_run":
                return "Cancel a running or waiting run. Args: runId";
            case "get_run_for_improvement":
                return "Get a failed run with its workflow definition and failing step. Args: runId";
            default:
                return "Retry a failed run against the current workflow definition. Args: runId";
        }
    }

    @Override
    public Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context) {
        try {
            switch (toolName) {
                case "execute_workflow":
                    return executeWorkflow(args);
                case "list_runs":
                    return listRuns();
                case "get_run":
                    return getRun(args);
                case "respond_to_run":
                    return respondToRun(args);
                case "cancel_run":
                    return cancelRun(args);
                case "get_run_for_improvement":
                    return getRunForImprovement(args);
                default:
                    return retryRun(args);
            }
        } catch (AppException ex) {
            log.info("Run tool rejected. tool={}, code={}, message={}", toolName, ex.getCode(), ex.getMessage());
            return error(ex.getMessage());
        }
    }

    private Map<String, Object> executeWorkflow(Map<String, Object> args) {
        Long workflowId = longValue(args, "workflowId", "id");
        if (workflowId == null) {
            String name = string(args, "name", "workflowName");
            if (name == null) {
                return error("workflowId or name is required");
            }
            WorkflowEntity workflow = workflowRepository.findByName(name);
            if (workflow == null) {
                return error("Workflow not found");
            }
            workflowId = workflow.getId();
        }
        RunDetailDTO run = workflowRunCommandService.startInline(workflowId, string(args, "input", "message"));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("runId", run.getId());
        result.put("status", run.getStatus());
        result.put("output", run.getOutput());
        result.put("steps", run.getTrail() == null ? 0 : run.getTrail().size());
        if (run.getPendingRequest() != null) {
            result.put("pendingRequest", run.getPendingRequest());
        }
        return result;
    }

    private Map<String, Object> listRuns() {
        List<RunSummaryDTO> runs = workflowRunQueryService.listRuns(LIST_LIMIT);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("runs", toList(runs));
        return result;
    }

    private Map<String, Object> getRun(Map<String, Object> args) {
        Long runId = longValue(args, "runId", "id");
        if (runId == null) {
            return error("runId is required");
        }
        return toMap(workflowRunQueryService.getRun(runId));
    }

    private Map<String, Object> respondToRun(Map<String, Object> args) {
        Long runId = longValue(args, "runId", "id");
        if (runId == null) {
            return error("runId is required");
        }
        String response = string(args, "response", "message");
        if (response == null) {
            return error("response is required");
        }
        RunDetailDTO run = workflowRunCommandService.respond(runId, response);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("runId", run.getId());
        result.put("status", run.getStatus());
        result.put("message", "Response recorded. The run will continue.");
        return result;
    }

    private Map<String, Object> cancelRun(Map<String, Object> args) {
        Long runId = longValue(args, "runId", "id");
        if (runId == null) {
            return error("runId is required");
        }
        RunDetailDTO run = workflowRunCommandService.cancel(runId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("runId", run.getId());
        result.put("status", run.getStatus());
        result.put("message", Boolean.TRUE.equals(run.getCancelRequested()) && "running".equals(run.getStatus())
                ? "Cancellation requested. The run stops before its next step."
                : "Run cancelled.");
        return result;
    }

    private Map<String, Object> getRunForImprovement(Map<String, Object> args) {
        Long runId = longValue(args, "runId", "id");
        if (runId == null) {
            return error("runId is required");
        }
        WorkflowRunEntity entity = workflowRunQueryService.requireRun(runId);
        RunDetailDTO run = workflowRunQueryService.getRun(runId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("run", toMap(run));
        WorkflowSnapshot snapshot = entity.getSnapshot();
        if (snapshot != null) {
            result.put("workflowSnapshot", objectMapper.convertValue(snapshot.getGraph(),
                    new TypeReference<Map<String, Object>>() {
                    }));
            result.put("agents", toList(snapshot.getAgents()));
        }
        WorkflowEntity current = workflowRepository.findById(entity.getWorkflowId());
        result.put("currentWorkflowVersion", current == null ? null : current.getVersion());
        List<Map<String, Object>> failingSteps = new ArrayList<>();
        if (run.getTrail() != null) {
            for (TrailStepDTO step : run.getTrail()) {
                if (step.getError() != null) {
                    failingSteps.add(toMap(step));
                }
            }
        }
        result.put("failingSteps", failingSteps);
        return result;
    }

    private Map<String, Object> retryRun(Map<String, Object> args) {
        Long runId = longValue(args, "runId", "id");
        if (runId == null) {
            return error("runId is required");
        }
        RunDetailDTO run = workflowRunCommandService.retry(runId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("runId", run.getId());
        result.put("retryOfRunId", run.getRetryOfRunId());
        result.put("retryAttempt", run.getRetryAttempt());
        result.put("status", run.getStatus());
        return result;
    }

    private Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, new TypeReference<Map<String, Object>>() {
        });
    }

    private List<Object> toList(Object value) {
        return objectMapper.convertValue(value, new TypeReference<List<Object>>() {
        });
    }
}
