package com.flowpilot.domain.run.service;

import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.run.adapter.repository.IWorkflowRunRepository;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.run.model.valobj.GraphRunnerOptions;
import com.flowpilot.domain.run.model.valobj.NodeTurnResult;
import com.flowpilot.domain.run.model.valobj.PendingVisit;
import com.flowpilot.domain.run.model.valobj.ResumeCursor;
import com.flowpilot.domain.run.model.valobj.TrailStep;
import com.flowpilot.domain.workflow.model.valobj.WorkflowEdge;
import com.flowpilot.domain.workflow.model.valobj.WorkflowGraph;
import com.flowpilot.domain.workflow.model.valobj.WorkflowNode;
import com.flowpilot.types.enums.ExecutionLogPhaseEnum;
import com.flowpilot.types.enums.ResumeNodeModeEnum;
import com.flowpilot.types.enums.RunStatusEnum;
import com.flowpilot.types.enums.WorkflowNodeTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * 工作流图执行领域服务。
 * <p>
 * 按 FIFO 依次访问节点：取消检查 → 节点回合 → 追加轨迹步骤 → 调度后继。
 * 每步之后持久化运行记录；需要用户输入时写入恢复游标并立即返回，不占用线程。
 * 后继若为入口节点或本轮已执行过，则进入下一轮，下一轮达到 maxRounds 时不再调度。
 * </p>
 */
@Slf4j
@Service
public class WorkflowGraphRunner {

    private static final int STACK_MAX = 1500;

    private final NodeTurnExecutor nodeTurnExecutor;
    private final IWorkflowRunRepository runRepository;
    private final ExecutionLogRecorder logRecorder;
    private final GraphRunnerOptions options;

    public WorkflowGraphRunner(NodeTurnExecutor nodeTurnExecutor,
                               IWorkflowRunRepository runRepository,
                               ExecutionLogRecorder logRecorder,
                               GraphRunnerOptions options) {
        this.nodeTurnExecutor = nodeTurnExecutor;
        this.runRepository = runRepository;
        this.logRecorder = logRecorder;
        this.options = options == null ? GraphRunnerOptions.builder().build() : options;
    }

    /**
     * 从入口节点开始执行。cancelled 在每个节点回合前检查，通常读取持久化的取消标记。
     */
    public WorkflowRunEntity start(WorkflowRunEntity run, BooleanSupplier cancelled) {
        WorkflowGraph graph = run.getSnapshot() == null ? null : run.getSnapshot().getGraph();
        List<String> errors = graph == null ? List.of("Workflow snapshot missing") : graph.validate();
        if (!errors.isEmpty()) {
            String message = "Workflow configuration error: " + String.join("; ", errors);
            log.warn("Workflow configuration invalid. runId={}, workflowId={}, errors={}",
                    run.getId(), run.getWorkflowId(), errors);
            run.fail(message, null);
            recordStatus(run);
            return runRepository.update(run);
        }
        ResumeCursor cursor = new ResumeCursor();
        run.setCursor(cursor);
        for (String entryId : graph.entryNodeIds()) {
            cursor.enqueue(new PendingVisit(entryId, run.getInitialInput(), 0, null, false));
        }
        log.info("Workflow run started. runId={}, workflowId={}, entryNodes={}",
                run.getId(), run.getWorkflowId(), graph.entryNodeIds());
        return drive(run, cancelled);
    }

    /**
     * 从恢复游标继续执行。用户回复已经由状态机写入游标。
     */
    public WorkflowRunEntity resume(WorkflowRunEntity run, BooleanSupplier cancelled) {
        ResumeCursor cursor = run.getCursor();
        if (cursor == null) {
            throw new IllegalStateException("Run " + run.getId() + " has no resume cursor");
        }
        WorkflowGraph graph = run.getSnapshot().getGraph();
        String reply = cursor.getUserResponse();
        WorkflowNode waitingNode = graph.findNode(cursor.getWaitingAtNodeId());
        ResumeNodeModeEnum mode = resumeModeOf(cursor, waitingNode);
        if (waitingNode != null) {
            if (mode == ResumeNodeModeEnum.SUCCESSORS) {
                cursor.setLastOutput(reply);
                cursor.getNodeOutputs().put(waitingNode.getId(), reply);
                List<String> errors = new ArrayList<>();
                scheduleSuccessors(run, waitingNode.getId(), reply, cursor.getWaitingRound(), errors);
                if (!errors.isEmpty()) {
                    log.warn("Successor scheduling errors on resume. runId={}, nodeId={}, errors={}",
                            run.getId(), waitingNode.getId(), errors);
                }
            } else {
                cursor.pushFront(new PendingVisit(waitingNode.getId(), reply, cursor.getWaitingRound(), null, true));
            }
        }
        log.info("Workflow run resumed. runId={}, waitingAtNodeId={}, mode={}, pendingVisits={}",
                run.getId(), cursor.getWaitingAtNodeId(), mode == null ? null : mode.getCode(),
                cursor.getPendingVisits().size());
        cursor.clearWaiting();
        cursor.setUserResponse(null);
        return drive(run, cancelled);
    }

    private WorkflowRunEntity drive(WorkflowRunEntity run, BooleanSupplier cancelled) {
        WorkflowGraph graph = run.getSnapshot().getGraph();
        int maxRounds = maxRounds(graph);
        while (run.getStatus() == RunStatusEnum.RUNNING) {
            ResumeCursor cursor = run.getCursor();
            if (isCancelled(run, cancelled)) {
                run.cancel();
                log.info("Workflow run cancelled. runId={}, steps={}", run.getId(), run.getTrail().size());
                recordStatus(run);
                return runRepository.update(run);
            }
            PendingVisit visit = cursor.poll();
            if (visit == null) {
                run.complete(cursor.getLastOutput());
                log.info("Workflow run completed. runId={}, steps={}", run.getId(), run.getTrail().size());
                recordStatus(run);
                return runRepository.update(run);
            }
            WorkflowNode node = graph.findNode(visit.getNodeId());
            if (node == null) {
                run.fail("Workflow configuration error: node not found: " + visit.getNodeId(), null);
                recordStatus(run);
                return runRepository.update(run);
            }
            try {
                run = visitNode(run, graph, node, visit, maxRounds);
            } catch (RuntimeException ex) {
                log.error("Node turn failed. runId={}, nodeId={}, round={}, error={}",
                        run.getId(), node.getId(), visit.getRound(), ex.getMessage(), ex);
                run.fail(StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()),
                        StringUtils.abbreviate(ExceptionUtils.getStackTrace(ex), STACK_MAX));
                recordStatus(run);
                return runRepository.update(run);
            }
        }
        return run;
    }

    private WorkflowRunEntity visitNode(WorkflowRunEntity run, WorkflowGraph graph, WorkflowNode node,
                                        PendingVisit visit, int maxRounds) {
        ResumeCursor cursor = run.getCursor();
        cursor.markVisited(visit.getRound(), node.getId());
        logRecorder.record(run.getId(), ExecutionLogPhaseEnum.NODE_START, node.getId(), visitPayload(visit));

        NodeTurnResult turn = nodeTurnExecutor.execute(run, node, visit, maxRounds, options);
        int order = run.getTrail() == null ? 0 : run.getTrail().size();
        TrailStep.TrailStepBuilder step = TrailStep.builder()
                .order(order)
                .round(visit.getRound())
                .nodeId(node.getId())
                .nodeType(node.nodeType().getCode())
                .agentId(turn.getAgentId())
                .agentName(turn.getAgentName())
                .input(visit.getInput())
                .output(turn.getOutput())
                .toolCalls(turn.getToolCalls())
                .inputIsUserReply(visit.isInputIsUserReply());

        if (turn.isWaiting()) {
            run.appendStep(step.waitingForUser(true).error(turn.getError()).build());
            cursor.markWaiting(node.getId(), visit.getRound(), ResumeNodeModeEnum.forNodeType(node.nodeType()),
                    turn.getPendingRequest());
            run.pause(turn.getPendingRequest());
            log.info("Workflow run waiting for user. runId={}, nodeId={}, round={}",
                    run.getId(), node.getId(), visit.getRound());
            recordStatus(run);
            return runRepository.update(run);
        }

        cursor.setLastOutput(turn.getOutput());
        cursor.getNodeOutputs().put(node.getId(), turn.getOutput());
        Map<String, Object> recent = new LinkedHashMap<>();
        recent.put("round", visit.getRound());
        recent.put("nodeId", node.getId());
        recent.put("agentName", turn.getAgentName());
        recent.put("output", turn.getOutput());
        cursor.recordTurn(recent, options.getRecentTurns());

        List<String> errors = new ArrayList<>();
        if (turn.getError() != null) {
            errors.add(turn.getError());
        }
        String firstTarget = scheduleSuccessors(run, node.getId(), turn.getOutput(), visit.getRound(), errors);
        WorkflowNode firstNode = graph.findNode(firstTarget);
        run.appendStep(step
                .sentToNodeId(firstTarget)
                .sentToAgentName(firstNode == null ? null : agentNameOf(run, firstNode))
                .error(errors.isEmpty() ? null : String.join("; ", errors))
                .build());
        WorkflowRunEntity saved = runRepository.update(run);
        logRecorder.record(run.getId(), ExecutionLogPhaseEnum.NODE_DONE, node.getId(), turn.getOutput());
        return saved;
    }

    /**
     * 调度后继，返回第一个被调度的节点 ID。悬空边写入 errors。
     */
    private String scheduleSuccessors(WorkflowRunEntity run, String nodeId, Object output, int round, List<String> errors) {
        WorkflowGraph graph = run.getSnapshot().getGraph();
        ResumeCursor cursor = run.getCursor();
        int maxRounds = maxRounds(graph);
        List<WorkflowEdge> outgoing = graph.outgoingEdges(nodeId);
        if (outgoing.isEmpty()) {
            return null;
        }
        String content = nodeTurnExecutor.toText(output);
        List<WorkflowEdge> matched = new ArrayList<>();
        for (WorkflowEdge edge : outgoing) {
            if (edge.matches(output, content)) {
                matched.add(edge);
            }
        }
        if (matched.isEmpty()) {
            matched.add(outgoing.get(0));
        }
        String first = null;
        for (WorkflowEdge edge : matched) {
            if (graph.findNode(edge.getTarget()) == null) {
                errors.add("Edge " + edge.getId() + " points to missing node " + edge.getTarget());
                continue;
            }
            int nextRound = graph.isEntryNode(edge.getTarget()) || cursor.visited(round, edge.getTarget())
                    ? round + 1 : round;
            if (nextRound >= maxRounds) {
                log.debug("Max rounds reached, successor skipped. runId={}, target={}, round={}",
                        run.getId(), edge.getTarget(), nextRound);
                continue;
            }
            if (cursor.enqueue(new PendingVisit(edge.getTarget(), output, nextRound, nodeId, false)) && first == null) {
                first = edge.getTarget();
            }
        }
        return first;
    }

    /**
     * 游标未记录恢复方式时（旧数据）按节点类型推断。
     */
    private ResumeNodeModeEnum resumeModeOf(ResumeCursor cursor, WorkflowNode waitingNode) {
        if (cursor.getResumeNodeMode() != null) {
            return cursor.getResumeNodeMode();
        }
        return waitingNode == null ? null : ResumeNodeModeEnum.forNodeType(waitingNode.nodeType());
    }

    private boolean isCancelled(WorkflowRunEntity run, BooleanSupplier cancelled) {
        if (cancelled != null && cancelled.getAsBoolean()) {
            return true;
        }
        return run.isCancelRequestedFlag();
    }

    private int maxRounds(WorkflowGraph graph) {
        Integer configured = graph.getMaxRounds();
        return configured != null && configured > 0 ? configured : Math.max(options.getDefaultMaxRounds(), 1);
    }

    private String agentNameOf(WorkflowRunEntity run, WorkflowNode node) {
        if (node.nodeType() != WorkflowNodeTypeEnum.AGENT) {
            return null;
        }
        AgentDefinitionEntity agent = run.getSnapshot().findAgent(node.parameter("agentId"), node.parameter("agentName"));
        return agent == null ? null : agent.getName();
    }

    private Map<String, Object> visitPayload(PendingVisit visit) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("round", visit.getRound());
        payload.put("fromNodeId", visit.getFromNodeId());
        payload.put("inputIsUserReply", visit.isInputIsUserReply());
        payload.put("input", visit.getInput());
        return payload;
    }

    private void recordStatus(WorkflowRunEntity run) {
        logRecorder.record(run.getId(), ExecutionLogPhaseEnum.RUN_STATUS, run.getStatus().getCode(), run.getOutput());
    }
}
