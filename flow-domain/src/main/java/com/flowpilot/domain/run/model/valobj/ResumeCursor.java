package com.flowpilot.domain.run.model.valobj;

import com.flowpilot.types.enums.ResumeNodeModeEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 恢复游标：挂起时剩余的执行现场，随运行记录一起持久化。
 */
@Data
public class ResumeCursor {

    /** 待访问节点 (FIFO) */
    private List<PendingVisit> pendingVisits = new ArrayList<>();

    /** 已到达的最大轮次 */
    private int round;

    /** 已执行节点，格式 round:nodeId */
    private List<String> visitedKeys = new ArrayList<>();

    private String waitingAtNodeId;

    private int waitingRound;

    /** 收到回复后的恢复方式 */
    private ResumeNodeModeEnum resumeNodeMode;

    private PendingRequest pendingRequest;

    private String userResponse;

    private List<ToolResultRecord> toolResults = new ArrayList<>();

    private Object lastOutput;

    private Map<String, Object> nodeOutputs = new LinkedHashMap<>();

    /** 最近若干回合摘要 */
    private List<Map<String, Object>> recentTurns = new ArrayList<>();

    public boolean hasPendingVisits() {
        return pendingVisits != null && !pendingVisits.isEmpty();
    }

    public PendingVisit poll() {
        if (!hasPendingVisits()) {
            return null;
        }
        return pendingVisits.remove(0);
    }

    /**
     * 入队；同一轮内已排队的节点不重复入队。
     */
    public boolean enqueue(PendingVisit visit) {
        if (visit == null || visit.getNodeId() == null) {
            return false;
        }
        for (PendingVisit pending : pendingVisits) {
            if (visit.getNodeId().equals(pending.getNodeId()) && visit.getRound() == pending.getRound()) {
                return false;
            }
        }
        pendingVisits.add(visit);
        round = Math.max(round, visit.getRound());
        return true;
    }

    public void pushFront(PendingVisit visit) {
        pendingVisits.add(0, visit);
        round = Math.max(round, visit.getRound());
    }

    public void markVisited(int visitRound, String nodeId) {
        String key = visitRound + ":" + nodeId;
        if (!visitedKeys.contains(key)) {
            visitedKeys.add(key);
        }
    }

    public boolean visited(int visitRound, String nodeId) {
        return visitedKeys.contains(visitRound + ":" + nodeId);
    }

    public void markWaiting(String nodeId, int visitRound, ResumeNodeModeEnum mode, PendingRequest request) {
        this.waitingAtNodeId = nodeId;
        this.waitingRound = visitRound;
        this.resumeNodeMode = mode;
        this.pendingRequest = request;
        this.userResponse = null;
    }

    public void clearWaiting() {
        this.waitingAtNodeId = null;
        this.resumeNodeMode = null;
        this.pendingRequest = null;
    }

    public void addToolResult(String name, Object result) {
        toolResults.add(new ToolResultRecord(name, result));
    }

    public void recordTurn(Map<String, Object> turn, int keep) {
        recentTurns.add(turn);
        int limit = Math.max(keep, 1);
        while (recentTurns.size() > limit) {
            recentTurns.remove(0);
        }
    }
}
