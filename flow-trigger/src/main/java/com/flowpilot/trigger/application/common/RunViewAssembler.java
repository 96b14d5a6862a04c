package com.flowpilot.trigger.application.common;

import com.flowpilot.api.dto.ExecutionLogEntryDTO;
import com.flowpilot.api.dto.RunDetailDTO;
import com.flowpilot.api.dto.RunSummaryDTO;
import com.flowpilot.api.dto.TrailStepDTO;
import com.flowpilot.api.dto.WorkflowJobDTO;
import com.flowpilot.domain.run.model.entity.ExecutionLogEntity;
import com.flowpilot.domain.run.model.entity.WorkflowJobEntity;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.model.valobj.PendingRequest;
import com.flowpilot.domain.run.model.valobj.ToolCallSummary;
import com.flowpilot.domain.run.model.valobj.TrailStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行视图组装器：运行、轨迹、队列任务与执行日志到 DTO 的映射。
 */
@Component
public class RunViewAssembler {

    public RunDetailDTO toRunDetailDTO(WorkflowRunEntity run) {
        if (run == null) {
            return null;
        }
        RunDetailDTO dto = new RunDetailDTO();
        dto.setId(run.getId());
        dto.setWorkflowId(run.getWorkflowId());
        dto.setStatus(run.getStatus() == null ? null : run.getStatus().getCode());
        dto.setInitialInput(run.getInitialInput());
        dto.setOutput(run.getOutput());
        List<TrailStepDTO> trail = new ArrayList<>();
        if (run.getTrail() != null) {
            for (TrailStep step : run.getTrail()) {
                trail.add(toTrailStepDTO(step));
            }
        }
        dto.setTrail(trail);
        if (run.isWaitingForUser() && run.getCursor() != null) {
            dto.setPendingRequest(toPendingRequestMap(run.getCursor().getPendingRequest()));
        }
        dto.setRetryOfRunId(run.getRetryOfRunId());
        dto.setRetryAttempt(run.getRetryAttempt());
        dto.setCancelRequested(run.getCancelRequested());
        dto.setStartedAt(run.getStartedAt());
        dto.setFinishedAt(run.getFinishedAt());
        dto.setCreatedAt(run.getCreatedAt());
        dto.setUpdatedAt(run.getUpdatedAt());
        return dto;
    }

    public RunSummaryDTO toRunSummaryDTO(WorkflowRunEntity run) {
        RunSummaryDTO dto = new RunSummaryDTO();
        dto.setId(run.getId());
        dto.setWorkflowId(run.getWorkflowId());
        if (run.getSnapshot() != null && run.getSnapshot().getGraph() != null) {
            dto.setWorkflowName(run.getSnapshot().getGraph().getName());
        }
        dto.setStatus(run.getStatus() == null ? null : run.getStatus().getCode());
        dto.setStepCount(run.getTrail() == null ? 0 : run.getTrail().size());
        dto.setRetryOfRunId(run.getRetryOfRunId());
        dto.setStartedAt(run.getStartedAt());
        dto.setFinishedAt(run.getFinishedAt());
        return dto;
    }

    public TrailStepDTO toTrailStepDTO(TrailStep step) {
        TrailStepDTO dto = new TrailStepDTO();
        dto.setOrder(step.getOrder());
        dto.setRound(step.getRound());
        dto.setNodeId(step.getNodeId());
        dto.setNodeType(step.getNodeType());
        dto.setAgentId(step.getAgentId());
        dto.setAgentName(step.getAgentName());
        dto.setInput(step.getInput());
        dto.setOutput(step.getOutput());
        List<Map<String, Object>> toolCalls = new ArrayList<>();
        if (step.getToolCalls() != null) {
            for (ToolCallSummary call : step.getToolCalls()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("name", call.getName());
                item.put("argsSummary", call.getArgsSummary());
                item.put("resultSummary", call.getResultSummary());
                item.put("failed", call.isFailed());
                toolCalls.add(item);
            }
        }
        dto.setToolCalls(toolCalls);
        dto.setInputIsUserReply(step.isInputIsUserReply());
        dto.setSentToNodeId(step.getSentToNodeId());
        dto.setSentToAgentName(step.getSentToAgentName());
        dto.setError(step.getError());
        dto.setWaitingForUser(step.isWaitingForUser());
        return dto;
    }

    public WorkflowJobDTO toWorkflowJobDTO(WorkflowJobEntity job) {
        WorkflowJobDTO dto = new WorkflowJobDTO();
        dto.setId(job.getId());
        dto.setType(job.getType() == null ? null : job.getType().getCode());
        dto.setRunId(job.getRunId());
        dto.setStatus(job.getStatus() == null ? null : job.getStatus().getCode());
        dto.setPayload(job.getPayload());
        dto.setError(job.getError());
        dto.setCreatedAt(job.getCreatedAt());
        dto.setStartedAt(job.getStartedAt());
        dto.setFinishedAt(job.getFinishedAt());
        return dto;
    }

    public ExecutionLogEntryDTO toExecutionLogEntryDTO(ExecutionLogEntity entry) {
        ExecutionLogEntryDTO dto = new ExecutionLogEntryDTO();
        dto.setSequence(entry.getSequence());
        dto.setPhase(entry.getPhase() == null ? null : entry.getPhase().getCode());
        dto.setLabel(entry.getLabel());
        dto.setPayload(entry.getPayload());
        dto.setCreatedAt(entry.getCreatedAt());
        return dto;
    }

    public Map<String, Object> toPendingRequestMap(PendingRequest request) {
        if (request == null) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("question", request.getQuestion());
        map.put("options", request.getOptions() == null ? new ArrayList<>() : request.getOptions());
        map.put("type", request.getType());
        map.put("reason", request.getReason());
        return map;
    }
}
