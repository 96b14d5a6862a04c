package com.flowpilot.domain.run.model.entity;

import com.flowpilot.domain.run.model.valobj.PendingRequest;
import com.flowpilot.domain.run.model.valobj.ResumeCursor;
import com.flowpilot.domain.run.model.valobj.TrailStep;
import com.flowpilot.domain.run.model.valobj.WorkflowSnapshot;
import com.flowpilot.types.common.Constants;
import com.flowpilot.types.enums.RunStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流运行实体
 */
@Data
public class WorkflowRunEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 工作流 ID
     */
    private Long workflowId;

    /**
     * 状态
     */
    private RunStatusEnum status;

    /**
     * 启动输入
     */
    private String initialInput;

    /**
     * 输出：成功为 {output}，失败为 {success:false, error, errorDetails}，挂起为待回答的问题
     */
    private Map<String, Object> output;

    /**
     * 执行轨迹
     */
    private List<TrailStep> trail = new ArrayList<>();

    /**
     * 恢复游标
     */
    private ResumeCursor cursor;

    /**
     * 启动时冻结的图与 Agent
     */
    private WorkflowSnapshot snapshot;

    /**
     * 重试来源运行 ID
     */
    private Long retryOfRunId;

    /**
     * 第几次自修复重试，首次运行为 0
     */
    private Integer retryAttempt;

    /**
     * 是否已请求取消 (独立字段更新，不参与乐观锁)
     */
    private Boolean cancelRequested;

    /**
     * 当前持有执行权的队列任务
     */
    private Long activeJobId;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (workflowId == null) {
            throw new IllegalStateException("Workflow ID cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * 创建运行中的新运行
     */
    public static WorkflowRunEntity create(Long workflowId, String input, WorkflowSnapshot snapshot) {
        WorkflowRunEntity run = new WorkflowRunEntity();
        LocalDateTime now = LocalDateTime.now();
        run.setWorkflowId(workflowId);
        run.setInitialInput(input);
        run.setSnapshot(snapshot);
        run.setStatus(RunStatusEnum.RUNNING);
        run.setRetryAttempt(0);
        run.setCancelRequested(false);
        run.setStartedAt(now);
        run.setCreatedAt(now);
        run.setUpdatedAt(now);
        return run;
    }

    public boolean isWaitingForUser() {
        return status == RunStatusEnum.WAITING_FOR_USER;
    }

    public boolean isCancelRequestedFlag() {
        return Boolean.TRUE.equals(cancelRequested);
    }

    public void appendStep(TrailStep step) {
        if (trail == null) {
            trail = new ArrayList<>();
        }
        trail.add(step);
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 完成
     */
    public void complete(Object lastOutput) {
        transitTo(RunStatusEnum.COMPLETED);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("output", lastOutput);
        this.output = payload;
        this.finishedAt = LocalDateTime.now();
    }

    /**
     * 标记为失败，保留错误信息与堆栈
     */
    public void fail(String message, String stack) {
        transitTo(RunStatusEnum.FAILED);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", message);
        if (stack != null) {
            details.put("stack", stack);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", false);
        payload.put("error", message);
        payload.put("errorDetails", details);
        this.output = payload;
        this.finishedAt = LocalDateTime.now();
    }

    /**
     * 挂起等待用户输入
     */
    public void pause(PendingRequest request) {
        transitTo(RunStatusEnum.WAITING_FOR_USER);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", Constants.WAITING_FOR_USER_MESSAGE);
        if (request != null) {
            payload.put("question", request.getQuestion());
            if (request.getOptions() != null && !request.getOptions().isEmpty()) {
                payload.put("options", request.getOptions());
            }
            if (request.getType() != null) {
                payload.put("type", request.getType());
            }
            if (request.getReason() != null) {
                payload.put("reason", request.getReason());
            }
        }
        if (cursor != null && cursor.getWaitingAtNodeId() != null) {
            payload.put("waitingAtNodeId", cursor.getWaitingAtNodeId());
        }
        payload.put("trail", trail == null ? new ArrayList<>() : new ArrayList<>(trail));
        this.output = payload;
    }

    /**
     * 用户回复后恢复为运行中，回复写入游标
     */
    public void acceptUserResponse(String response) {
        if (status != RunStatusEnum.WAITING_FOR_USER) {
            throw new IllegalStateException("Run is not waiting for user input (status: " + codeOf(status) + ")");
        }
        transitTo(RunStatusEnum.RUNNING);
        if (cursor == null) {
            cursor = new ResumeCursor();
        }
        cursor.setUserResponse(response);
        Map<String, Object> payload = output == null ? new LinkedHashMap<>() : new LinkedHashMap<>(output);
        payload.remove("trail");
        payload.put("userResponded", true);
        payload.put("response", response);
        this.output = payload;
    }

    /**
     * 取消
     */
    public void cancel() {
        transitTo(RunStatusEnum.CANCELLED);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", false);
        payload.put("error", Constants.RUN_CANCELLED_MESSAGE);
        this.output = payload;
        this.finishedAt = LocalDateTime.now();
    }

    private void transitTo(RunStatusEnum target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal run transition: " + codeOf(status) + " -> " + target.getCode());
        }
        this.status = target;
        this.updatedAt = LocalDateTime.now();
    }

    private static String codeOf(RunStatusEnum status) {
        return status == null ? "null" : status.getCode();
    }
}
