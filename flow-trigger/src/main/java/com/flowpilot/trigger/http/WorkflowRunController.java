package com.flowpilot.trigger.http;

import com.flowpilot.api.dto.ExecutionLogEntryDTO;
import com.flowpilot.api.dto.RunDetailDTO;
import com.flowpilot.api.dto.RunRespondRequestDTO;
import com.flowpilot.api.dto.RunStartRequestDTO;
import com.flowpilot.api.dto.RunSummaryDTO;
import com.flowpilot.api.response.Response;
import com.flowpilot.trigger.application.command.WorkflowRunCommandService;
import com.flowpilot.trigger.application.query.WorkflowRunQueryService;
import com.flowpilot.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 工作流运行 API：启动、回复、取消、重试与查询。
 */
@RestController
@RequestMapping("/api")
public class WorkflowRunController {

    private final WorkflowRunCommandService workflowRunCommandService;
    private final WorkflowRunQueryService workflowRunQueryService;

    public WorkflowRunController(WorkflowRunCommandService workflowRunCommandService,
                                 WorkflowRunQueryService workflowRunQueryService) {
        this.workflowRunCommandService = workflowRunCommandService;
        this.workflowRunQueryService = workflowRunQueryService;
    }

    @PostMapping("/workflows/{id}/execute")
    public Response<RunDetailDTO> execute(@PathVariable("id") Long workflowId,
                                          @RequestBody(required = false) RunStartRequestDTO request) {
        String input = request == null ? null : request.getInput();
        return success(workflowRunCommandService.start(workflowId, input));
    }

    @PostMapping("/runs/{id}/respond")
    public Response<RunDetailDTO> respond(@PathVariable("id") Long runId,
                                          @RequestBody(required = false) RunRespondRequestDTO request) {
        if (request == null || request.getResponse() == null) {
            throw new IllegalArgumentException("response is required");
        }
        return success(workflowRunCommandService.respond(runId, request.getResponse()));
    }

    @PostMapping("/runs/{id}/cancel")
    public Response<RunDetailDTO> cancel(@PathVariable("id") Long runId) {
        return success(workflowRunCommandService.cancel(runId));
    }

    @PostMapping("/runs/{id}/retry")
    public Response<RunDetailDTO> retry(@PathVariable("id") Long runId) {
        return success(workflowRunCommandService.retry(runId));
    }

    @GetMapping("/runs/{id}")
    public Response<RunDetailDTO> getRun(@PathVariable("id") Long runId) {
        return success(workflowRunQueryService.getRun(runId));
    }

    @GetMapping("/runs")
    public Response<List<RunSummaryDTO>> listRuns(@RequestParam(value = "limit", defaultValue = "20") Integer limit) {
        return success(workflowRunQueryService.listRuns(limit));
    }

    @GetMapping("/runs/{id}/logs")
    public Response<List<ExecutionLogEntryDTO>> getLogs(@PathVariable("id") Long runId) {
        return success(workflowRunQueryService.getLogs(runId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
