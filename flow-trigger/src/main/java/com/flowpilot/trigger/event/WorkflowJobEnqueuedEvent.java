package com.flowpilot.trigger.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 队列任务入队事件，用于唤醒队列守护进程。
 */
@Getter
@AllArgsConstructor
public class WorkflowJobEnqueuedEvent {

    private final Long jobId;

    private final Long runId;
}
