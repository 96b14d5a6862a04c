package com.flowpilot.domain.run.model.entity;

import com.flowpilot.types.enums.WorkflowJobStatusEnum;
import com.flowpilot.types.enums.WorkflowJobTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 执行队列任务实体
 */
@Data
public class WorkflowJobEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 任务类型
     */
    private WorkflowJobTypeEnum type;

    /**
     * 运行 ID
     */
    private Long runId;

    /**
     * 状态
     */
    private WorkflowJobStatusEnum status;

    /**
     * 附加载荷，恢复任务携带 resumeUserResponse
     */
    private Map<String, Object> payload = new LinkedHashMap<>();

    /**
     * 失败原因
     */
    private String error;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    public static WorkflowJobEntity queued(WorkflowJobTypeEnum type, Long runId, Map<String, Object> payload) {
        WorkflowJobEntity job = new WorkflowJobEntity();
        job.setType(type);
        job.setRunId(runId);
        job.setStatus(WorkflowJobStatusEnum.QUEUED);
        job.setPayload(payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload));
        job.setCreatedAt(LocalDateTime.now());
        return job;
    }

    public void complete() {
        if (status != WorkflowJobStatusEnum.RUNNING) {
            throw new IllegalStateException("Only running jobs can be completed");
        }
        this.status = WorkflowJobStatusEnum.COMPLETED;
        this.finishedAt = LocalDateTime.now();
    }

    public void fail(String error) {
        this.status = WorkflowJobStatusEnum.FAILED;
        this.error = error;
        this.finishedAt = LocalDateTime.now();
    }
}
