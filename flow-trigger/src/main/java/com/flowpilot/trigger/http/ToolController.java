package com.flowpilot.trigger.http;

import com.flowpilot.api.dto.ToolExecuteRequestDTO;
import com.flowpilot.api.response.Response;
import com.flowpilot.domain.run.adapter.repository.IWorkflowRunRepository;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.tool.service.ToolDispatcher;
import com.flowpilot.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 工具直调 API，供规划层使用，返回分发器的原始结果。
 */
@Slf4j
@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolDispatcher toolDispatcher;
    private final IWorkflowRunRepository workflowRunRepository;

    public ToolController(ToolDispatcher toolDispatcher, IWorkflowRunRepository workflowRunRepository) {
        this.toolDispatcher = toolDispatcher;
        this.workflowRunRepository = workflowRunRepository;
    }

    @PostMapping("/{name}/execute")
    public Response<Object> execute(@PathVariable("name") String toolName,
                                    @RequestBody(required = false) ToolExecuteRequestDTO request) {
        ToolExecutionContext context = ToolExecutionContext.empty();
        if (request != null && request.getRunId() != null) {
            context.setRunId(request.getRunId());
            WorkflowRunEntity run = workflowRunRepository.findById(request.getRunId());
            if (run != null) {
                context.setWorkflowId(run.getWorkflowId());
            }
        }
        Object result = toolDispatcher.execute(toolName, request == null ? null : request.getArgs(), context);
        log.info("Tool executed via API. tool={}, runId={}", toolName, context.getRunId());
        return Response.<Object>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(result)
                .build();
    }
}
