package com.flowpilot.trigger.application.command;

import com.flowpilot.api.dto.RunDetailDTO;
import com.flowpilot.domain.agent.adapter.repository.IAgentDefinitionRepository;
import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.run.adapter.repository.IWorkflowJobRepository;
import com.flowpilot.domain.run.adapter.repository.IWorkflowRunRepository;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.model.valobj.WorkflowSnapshot;
import com.flowpilot.domain.run.service.WorkflowGraphRunner;
import com.flowpilot.domain.workflow.adapter.repository.IWorkflowRepository;
import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;
import com.flowpilot.domain.workflow.model.valobj.WorkflowGraph;
import com.flowpilot.domain.workflow.model.valobj.WorkflowNode;
import com.flowpilot.trigger.application.common.RunViewAssembler;
import com.flowpilot.trigger.application.queue.WorkflowQueueService;
import com.flowpilot.types.enums.ResponseCode;
import com.flowpilot.types.enums.RunStatusEnum;
import com.flowpilot.types.enums.WorkflowJobTypeEnum;
import com.flowpilot.types.exception.AppException;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

/**
 * 运行写用例：启动、回复、取消与自修复重试。
 * <p>
 * 同一运行的写操作通过分段锁串行化，保证并发的两次回复只有一次生效。
 * </p>
 */
@Slf4j
@Service
public class WorkflowRunCommandService {

    private final IWorkflowRepository workflowRepository;
    private final IAgentDefinitionRepository agentDefinitionRepository;
    private final IWorkflowRunRepository workflowRunRepository;
    private final IWorkflowJobRepository workflowJobRepository;
    private final WorkflowQueueService workflowQueueService;
    private final WorkflowGraphRunner workflowGraphRunner;
    private final RunViewAssembler runViewAssembler;
    private final Striped<Lock> runLocks;
    private final int maxSelfFixRetries;

    public WorkflowRunCommandService(IWorkflowRepository workflowRepository,
                                     IAgentDefinitionRepository agentDefinitionRepository,
                                     IWorkflowRunRepository workflowRunRepository,
                                     IWorkflowJobRepository workflowJobRepository,
                                     WorkflowQueueService workflowQueueService,
                                     WorkflowGraphRunner workflowGraphRunner,
                                     RunViewAssembler runViewAssembler,
                                     Striped<Lock> runLocks,
                                     @Value("${flow.runner.max-self-fix-retries:2}") int maxSelfFixRetries) {
        this.workflowRepository = workflowRepository;
        this.agentDefinitionRepository = agentDefinitionRepository;
        this.workflowRunRepository = workflowRunRepository;
        this.workflowJobRepository = workflowJobRepository;
        this.workflowQueueService = workflowQueueService;
        this.workflowGraphRunner = workflowGraphRunner;
        this.runViewAssembler = runViewAssembler;
        this.runLocks = runLocks;
        this.maxSelfFixRetries = maxSelfFixRetries;
    }

    /**
     * 创建运行并入队启动任务，立即返回运行中的运行。
     */
    public RunDetailDTO start(Long workflowId, String input) {
        WorkflowRunEntity run = createRun(requireWorkflow(workflowId), input);
        workflowQueueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);
        return runViewAssembler.toRunDetailDTO(run);
    }

    /**
     * 在当前线程内同步执行到完成、失败、取消或挂起。
     */
    public RunDetailDTO startInline(Long workflowId, String input) {
        WorkflowRunEntity run = createRun(requireWorkflow(workflowId), input);
        Long runId = run.getId();
        WorkflowRunEntity finished = workflowGraphRunner.start(run, () -> workflowRunRepository.isCancelRequested(runId));
        return runViewAssembler.toRunDetailDTO(finished);
    }

    /**
     * 回复挂起的运行，恢复任务入队。
     */
    public RunDetailDTO respond(Long runId, String response) {
        Lock lock = runLocks.get(runId);
        lock.lock();
        try {
            WorkflowRunEntity run = requireRun(runId);
            if (!run.isWaitingForUser()) {
                throw new AppException(ResponseCode.RUN_NOT_PENDING.getCode(),
                        "Run is not waiting for user input (status: " + run.getStatus().getCode() + ")");
            }
            String reply = StringUtils.defaultString(response);
            run.acceptUserResponse(reply);
            run = workflowRunRepository.update(run);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(WorkflowQueueService.RESUME_USER_RESPONSE, reply);
            workflowQueueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_RESUME, runId, payload);
            log.info("Workflow run response accepted. runId={}, waitingAtNodeId={}",
                    runId, run.getCursor() == null ? null : run.getCursor().getWaitingAtNodeId());
            return runViewAssembler.toRunDetailDTO(run);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取消运行：挂起中的运行立即取消；运行中的运行设置取消标记，由执行器在下一个节点前生效。
     */
    public RunDetailDTO cancel(Long runId) {
        Lock lock = runLocks.get(runId);
        lock.lock();
        try {
            WorkflowRunEntity run = requireRun(runId);
            if (run.isWaitingForUser()) {
                run.cancel();
                run = workflowRunRepository.update(run);
                int removed = workflowJobRepository.deleteQueuedByRunId(runId);
                log.info("Waiting workflow run cancelled. runId={}, removedJobs={}", runId, removed);
                return runViewAssembler.toRunDetailDTO(run);
            }
            if (run.getStatus() == RunStatusEnum.RUNNING) {
                workflowRunRepository.requestCancel(runId);
                run.setCancelRequested(true);
                log.info("Workflow run cancel requested. runId={}", runId);
                return runViewAssembler.toRunDetailDTO(run);
            }
            throw new AppException(ResponseCode.RUN_NOT_CANCELLABLE.getCode(),
                    "Run cannot be cancelled (status: " + run.getStatus().getCode() + ")");
        } finally {
            lock.unlock();
        }
    }

    /**
     * 自修复重试：基于最新的工作流定义创建新运行，沿用原始输入。
     */
    public RunDetailDTO retry(Long runId) {
        WorkflowRunEntity source = requireRun(runId);
        if (source.getStatus() != RunStatusEnum.FAILED) {
            throw new AppException(ResponseCode.RUN_NOT_RETRYABLE.getCode(),
                    "Only failed runs can be retried (status: " + source.getStatus().getCode() + ")");
        }
        int attempt = (source.getRetryAttempt() == null ? 0 : source.getRetryAttempt()) + 1;
        if (attempt > maxSelfFixRetries) {
            throw new AppException(ResponseCode.RETRY_LIMIT_EXCEEDED.getCode(),
                    "Retry limit reached (" + maxSelfFixRetries + ")");
        }
        WorkflowEntity workflow = requireWorkflow(source.getWorkflowId());
        WorkflowRunEntity run = WorkflowRunEntity.create(workflow.getId(), source.getInitialInput(), snapshotOf(workflow));
        run.setRetryOfRunId(source.getId());
        run.setRetryAttempt(attempt);
        run = workflowRunRepository.save(run);
        workflowQueueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);
        log.info("Workflow run retried. runId={}, retryOfRunId={}, attempt={}", run.getId(), source.getId(), attempt);
        return runViewAssembler.toRunDetailDTO(run);
    }

    /**
     * 冻结工作流图与节点引用的 Agent
     */
    public WorkflowSnapshot snapshotOf(WorkflowEntity workflow) {
        WorkflowGraph graph = workflow.toGraph();
        List<AgentDefinitionEntity> agents = new ArrayList<>();
        List<Long> seen = new ArrayList<>();
        for (WorkflowNode node : graph.getNodes()) {
            AgentDefinitionEntity agent = resolveAgent(node);
            if (agent != null && !seen.contains(agent.getId())) {
                seen.add(agent.getId());
                agents.add(agent);
            }
        }
        return new WorkflowSnapshot(graph, agents);
    }

    private AgentDefinitionEntity resolveAgent(WorkflowNode node) {
        Object agentId = node.parameter("agentId");
        if (agentId != null) {
            long id = NumberUtils.toLong(String.valueOf(agentId).trim(), -1L);
            if (id > 0) {
                AgentDefinitionEntity agent = agentDefinitionRepository.findById(id);
                if (agent != null) {
                    return agent;
                }
            }
        }
        Object agentName = node.parameter("agentName");
        if (agentName != null && StringUtils.isNotBlank(String.valueOf(agentName))) {
            return agentDefinitionRepository.findByName(String.valueOf(agentName).trim());
        }
        return null;
    }

    private WorkflowRunEntity createRun(WorkflowEntity workflow, String input) {
        WorkflowRunEntity run = WorkflowRunEntity.create(workflow.getId(), input, snapshotOf(workflow));
        run = workflowRunRepository.save(run);
        log.info("Workflow run created. runId={}, workflowId={}, agents={}",
                run.getId(), workflow.getId(), run.getSnapshot().getAgents().size());
        return run;
    }

    private WorkflowEntity requireWorkflow(Long workflowId) {
        WorkflowEntity workflow = workflowId == null ? null : workflowRepository.findById(workflowId);
        if (workflow == null) {
            throw new AppException(ResponseCode.WORKFLOW_NOT_FOUND.getCode(), "Workflow not found");
        }
        return workflow;
    }

    private WorkflowRunEntity requireRun(Long runId) {
        WorkflowRunEntity run = runId == null ? null : workflowRunRepository.findById(runId);
        if (run == null) {
            throw new AppException(ResponseCode.RUN_NOT_FOUND.getCode(), "Run not found");
        }
        return run;
    }
}
