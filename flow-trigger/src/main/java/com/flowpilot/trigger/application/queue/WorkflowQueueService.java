package com.flowpilot.trigger.application.queue;

import com.flowpilot.api.dto.WorkflowJobDTO;
import com.flowpilot.api.dto.WorkflowQueueStatusDTO;
import com.flowpilot.domain.run.adapter.repository.IWorkflowJobRepository;
import com.flowpilot.domain.run.adapter.repository.IWorkflowRunRepository;
import com.flowpilot.domain.run.model.entity.WorkflowJobEntity;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.service.WorkflowGraphRunner;
import com.flowpilot.trigger.application.common.RunViewAssembler;
import com.flowpilot.trigger.event.WorkflowJobEnqueuedEvent;
import com.flowpilot.types.enums.ResponseCode;
import com.flowpilot.types.enums.RunStatusEnum;
import com.flowpilot.types.enums.WorkflowJobStatusEnum;
import com.flowpilot.types.enums.WorkflowJobTypeEnum;
import com.flowpilot.types.exception.AppException;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;

/**
 * 可恢复执行队列：入队、认领并执行单个任务、陈旧任务回收与队列查询。
 * <p>
 * 认领保证同一运行同一时刻至多一个 running 任务；任务在执行前把自身 ID 写入运行的 activeJobId，
 * 执行结束后清除。租约读写与用户回复、取消共用同一把按运行 ID 分段的锁。
 * </p>
 */
@Slf4j
@Service
public class WorkflowQueueService {

    public static final String RESUME_USER_RESPONSE = "resumeUserResponse";

    private static final int ERROR_MAX = 1000;

    private static final int STACK_MAX = 1500;

    private final IWorkflowJobRepository workflowJobRepository;
    private final IWorkflowRunRepository workflowRunRepository;
    private final WorkflowGraphRunner workflowGraphRunner;
    private final RunViewAssembler runViewAssembler;
    private final ApplicationEventPublisher eventPublisher;
    private final Striped<Lock> runLocks;
    private final MeterRegistry meterRegistry;
    private final int concurrency;
    private final long staleJobTimeoutMs;

    public WorkflowQueueService(IWorkflowJobRepository workflowJobRepository,
                                IWorkflowRunRepository workflowRunRepository,
                                WorkflowGraphRunner workflowGraphRunner,
                                RunViewAssembler runViewAssembler,
                                ApplicationEventPublisher eventPublisher,
                                Striped<Lock> runLocks,
                                @Value("${flow.queue.concurrency:2}") int concurrency,
                                @Value("${flow.queue.stale-job-timeout-ms:600000}") long staleJobTimeoutMs) {
        this.workflowJobRepository = workflowJobRepository;
        this.workflowRunRepository = workflowRunRepository;
        this.workflowGraphRunner = workflowGraphRunner;
        this.runViewAssembler = runViewAssembler;
        this.eventPublisher = eventPublisher;
        this.runLocks = runLocks;
        this.meterRegistry = Metrics.globalRegistry;
        this.concurrency = Math.max(1, concurrency);
        this.staleJobTimeoutMs = Math.max(1000L, staleJobTimeoutMs);
    }

    /**
     * 入队并发布唤醒事件
     */
    public WorkflowJobEntity enqueue(WorkflowJobTypeEnum type, Long runId, Map<String, Object> payload) {
        WorkflowJobEntity job = workflowJobRepository.save(WorkflowJobEntity.queued(type, runId, payload));
        log.info("Workflow job enqueued. jobId={}, runId={}, type={}", job.getId(), runId, type.getCode());
        eventPublisher.publishEvent(new WorkflowJobEnqueuedEvent(job.getId(), runId));
        return job;
    }

    /**
     * 认领并执行一个任务，队列为空时返回 false。
     */
    public boolean processOneWorkflowJob() {
        WorkflowJobEntity job = workflowJobRepository.claimNext();
        if (job == null) {
            return false;
        }
        long startedAt = System.currentTimeMillis();
        try {
            executeJob(job);
            job.complete();
            workflowJobRepository.update(job);
            meterRegistry.counter("flow.queue.job.processed.total", "type", job.getType().getCode()).increment();
            log.info("Workflow job completed. jobId={}, runId={}, costMs={}",
                    job.getId(), job.getRunId(), System.currentTimeMillis() - startedAt);
        } catch (RuntimeException ex) {
            log.error("Workflow job failed. jobId={}, runId={}, error={}",
                    job.getId(), job.getRunId(), ex.getMessage(), ex);
            String message = StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
            job.fail(StringUtils.abbreviate(message, ERROR_MAX));
            workflowJobRepository.update(job);
            failRunningRun(job, message, StringUtils.abbreviate(ExceptionUtils.getStackTrace(ex), STACK_MAX));
            meterRegistry.counter("flow.queue.job.failed.total", "type", job.getType().getCode()).increment();
        } finally {
            releaseLease(job);
        }
        return true;
    }

    /**
     * 回收执行超时的任务：任务置为失败，仍在运行中的运行一并失败。
     */
    public int failStaleJobs() {
        LocalDateTime before = LocalDateTime.now().minus(Duration.ofMillis(staleJobTimeoutMs));
        List<WorkflowJobEntity> staleJobs = workflowJobRepository.findRunningStartedBefore(before);
        for (WorkflowJobEntity job : staleJobs) {
            String message = "Job exceeded " + staleJobTimeoutMs + "ms without finishing";
            job.fail(message);
            workflowJobRepository.update(job);
            failRunningRun(job, message, null);
            meterRegistry.counter("flow.queue.job.stale.total").increment();
            log.warn("Stale workflow job failed. jobId={}, runId={}, startedAt={}",
                    job.getId(), job.getRunId(), job.getStartedAt());
        }
        return staleJobs.size();
    }

    public WorkflowQueueStatusDTO status() {
        return new WorkflowQueueStatusDTO(
                workflowJobRepository.countByStatus(WorkflowJobStatusEnum.QUEUED),
                workflowJobRepository.countByStatus(WorkflowJobStatusEnum.RUNNING),
                concurrency);
    }

    public List<WorkflowJobDTO> listJobs(String status, int limit) {
        WorkflowJobStatusEnum statusEnum;
        try {
            statusEnum = StringUtils.isBlank(status) ? null : WorkflowJobStatusEnum.fromCode(status.trim());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage());
        }
        List<WorkflowJobDTO> result = new ArrayList<>();
        for (WorkflowJobEntity job : workflowJobRepository.findRecent(statusEnum, clampLimit(limit))) {
            result.add(runViewAssembler.toWorkflowJobDTO(job));
        }
        return result;
    }

    public WorkflowJobDTO getJob(Long jobId) {
        WorkflowJobEntity job = workflowJobRepository.findById(jobId);
        if (job == null) {
            throw new AppException(ResponseCode.JOB_NOT_FOUND.getCode(), "Job not found");
        }
        return runViewAssembler.toWorkflowJobDTO(job);
    }

    public int getConcurrency() {
        return concurrency;
    }

    private void executeJob(WorkflowJobEntity job) {
        WorkflowRunEntity run = workflowRunRepository.findById(job.getRunId());
        if (run == null) {
            throw new IllegalStateException("Run not found: " + job.getRunId());
        }
        if (run.getStatus() != RunStatusEnum.RUNNING) {
            log.info("Skip workflow job for non-running run. jobId={}, runId={}, status={}",
                    job.getId(), run.getId(), run.getStatus().getCode());
            return;
        }
        run = acquireLease(job);
        if (run == null) {
            return;
        }
        Long runId = run.getId();
        BooleanSupplier cancelled = () -> workflowRunRepository.isCancelRequested(runId);
        if (job.getType() == WorkflowJobTypeEnum.WORKFLOW_RESUME) {
            Object reply = job.getPayload() == null ? null : job.getPayload().get(RESUME_USER_RESPONSE);
            if (run.getCursor() != null && run.getCursor().getUserResponse() == null && reply != null) {
                run.getCursor().setUserResponse(String.valueOf(reply));
            }
            workflowGraphRunner.resume(run, cancelled);
        } else {
            workflowGraphRunner.start(run, cancelled);
        }
    }

    /**
     * 加锁后重新读取运行并写入租约；运行在此期间离开 running 时返回 null。
     */
    private WorkflowRunEntity acquireLease(WorkflowJobEntity job) {
        Lock lock = runLocks.get(job.getRunId());
        lock.lock();
        try {
            WorkflowRunEntity run = workflowRunRepository.findById(job.getRunId());
            if (run == null || run.getStatus() != RunStatusEnum.RUNNING) {
                return null;
            }
            run.setActiveJobId(job.getId());
            return workflowRunRepository.update(run);
        } finally {
            lock.unlock();
        }
    }

    private void releaseLease(WorkflowJobEntity job) {
        Lock lock = runLocks.get(job.getRunId());
        lock.lock();
        try {
            WorkflowRunEntity run = workflowRunRepository.findById(job.getRunId());
            if (run != null && job.getId().equals(run.getActiveJobId())) {
                run.setActiveJobId(null);
                workflowRunRepository.update(run);
            }
        } catch (RuntimeException ex) {
            log.warn("Release workflow job lease failed. jobId={}, runId={}, error={}",
                    job.getId(), job.getRunId(), ex.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 任务异常或超时后，仍停留在 running 的运行一并置为失败，避免无人推进。
     */
    private void failRunningRun(WorkflowJobEntity job, String message, String stack) {
        Lock lock = runLocks.get(job.getRunId());
        lock.lock();
        try {
            WorkflowRunEntity run = workflowRunRepository.findById(job.getRunId());
            if (run == null || run.getStatus() != RunStatusEnum.RUNNING) {
                return;
            }
            run.fail(message, stack);
            run.setActiveJobId(null);
            workflowRunRepository.update(run);
            log.warn("Workflow run failed with its job. runId={}, jobId={}, error={}",
                    run.getId(), job.getId(), message);
        } catch (RuntimeException ex) {
            log.error("Fail workflow run after job error failed. jobId={}, runId={}, error={}",
                    job.getId(), job.getRunId(), ex.getMessage(), ex);
        } finally {
            lock.unlock();
        }
    }

    private int clampLimit(int limit) {
        if (limit <= 0) {
            return 50;
        }
        return Math.min(limit, 200);
    }
}
