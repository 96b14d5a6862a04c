package com.flowpilot.trigger.http;

import com.flowpilot.api.dto.WorkflowJobDTO;
import com.flowpilot.api.dto.WorkflowQueueStatusDTO;
import com.flowpilot.api.response.Response;
import com.flowpilot.trigger.application.queue.WorkflowQueueService;
import com.flowpilot.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 执行队列观测 API。
 */
@RestController
@RequestMapping("/api/queue")
public class WorkflowQueueController {

    private final WorkflowQueueService workflowQueueService;

    public WorkflowQueueController(WorkflowQueueService workflowQueueService) {
        this.workflowQueueService = workflowQueueService;
    }

    @GetMapping("/status")
    public Response<WorkflowQueueStatusDTO> status() {
        return success(workflowQueueService.status());
    }

    @GetMapping("/jobs")
    public Response<List<WorkflowJobDTO>> listJobs(@RequestParam(value = "status", required = false) String status,
                                                   @RequestParam(value = "limit", defaultValue = "50") Integer limit) {
        return success(workflowQueueService.listJobs(status, limit));
    }

    @GetMapping("/jobs/{id}")
    public Response<WorkflowJobDTO> getJob(@PathVariable("id") Long jobId) {
        return success(workflowQueueService.getJob(jobId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
