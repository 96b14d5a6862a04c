package com.flowpilot.trigger.application.query;

import com.flowpilot.api.dto.ExecutionLogEntryDTO;
import com.flowpilot.api.dto.RunDetailDTO;
import com.flowpilot.api.dto.RunSummaryDTO;
import com.flowpilot.domain.run.adapter.repository.IExecutionLogRepository;
import com.flowpilot.domain.run.adapter.repository.IWorkflowRunRepository;
import com.flowpilot.domain.run.model.entity.ExecutionLogEntity;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.trigger.application.common.RunViewAssembler;
import com.flowpilot.types.enums.ResponseCode;
import com.flowpilot.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 运行读用例：详情、列表与执行日志。
 */
@Service
public class WorkflowRunQueryService {

    private static final int MAX_LIST_LIMIT = 200;
    private static final int LOG_LIMIT = 2000;

    private final IWorkflowRunRepository workflowRunRepository;
    private final IExecutionLogRepository executionLogRepository;
    private final RunViewAssembler runViewAssembler;

    public WorkflowRunQueryService(IWorkflowRunRepository workflowRunRepository,
                                   IExecutionLogRepository executionLogRepository,
                                   RunViewAssembler runViewAssembler) {
        this.workflowRunRepository = workflowRunRepository;
        this.executionLogRepository = executionLogRepository;
        this.runViewAssembler = runViewAssembler;
    }

    public RunDetailDTO getRun(Long runId) {
        return runViewAssembler.toRunDetailDTO(requireRun(runId));
    }

    public WorkflowRunEntity requireRun(Long runId) {
        WorkflowRunEntity run = runId == null ? null : workflowRunRepository.findById(runId);
        if (run == null) {
            throw new AppException(ResponseCode.RUN_NOT_FOUND.getCode(), "Run not found");
        }
        return run;
    }

    public List<RunSummaryDTO> listRuns(int limit) {
        int safeLimit = limit <= 0 ? 20 : Math.min(limit, MAX_LIST_LIMIT);
        List<RunSummaryDTO> result = new ArrayList<>();
        for (WorkflowRunEntity run : workflowRunRepository.findRecent(safeLimit)) {
            result.add(runViewAssembler.toRunSummaryDTO(run));
        }
        return result;
    }

    public List<ExecutionLogEntryDTO> getLogs(Long runId) {
        requireRun(runId);
        List<ExecutionLogEntryDTO> result = new ArrayList<>();
        for (ExecutionLogEntity entry : executionLogRepository.findByRunId(runId, LOG_LIMIT)) {
            result.add(runViewAssembler.toExecutionLogEntryDTO(entry));
        }
        return result;
    }
}
