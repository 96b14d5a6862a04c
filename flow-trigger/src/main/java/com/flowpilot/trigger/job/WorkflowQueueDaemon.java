package com.flowpilot.trigger.job;

import com.flowpilot.trigger.application.queue.WorkflowQueueService;
import com.flowpilot.trigger.event.WorkflowJobEnqueuedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue daemon: keep up to {@code flow.queue.concurrency} workers draining the workflow job queue.
 */
@Slf4j
@Component
public class WorkflowQueueDaemon {

    private final WorkflowQueueService workflowQueueService;
    private final ThreadPoolExecutor workflowJobWorker;
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final boolean enabled;

    public WorkflowQueueDaemon(WorkflowQueueService workflowQueueService,
                               @Qualifier("workflowJobWorker") ThreadPoolExecutor workflowJobWorker,
                               @Value("${flow.queue.enabled:true}") boolean enabled) {
        this.workflowQueueService = workflowQueueService;
        this.workflowJobWorker = workflowJobWorker;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${flow.queue.poll-interval-ms:1000}", scheduler = "daemonScheduler")
    public void poll() {
        if (!enabled) {
            return;
        }
        try {
            int stale = workflowQueueService.failStaleJobs();
            if (stale > 0) {
                log.warn("Stale workflow jobs recycled. count={}", stale);
            }
        } catch (Exception ex) {
            log.warn("Failed to recycle stale workflow jobs. error={}", ex.getMessage());
        }
        pump();
    }

    @EventListener
    public void onJobEnqueued(WorkflowJobEnqueuedEvent event) {
        if (!enabled) {
            return;
        }
        log.debug("Workflow job enqueued, waking queue. jobId={}, runId={}", event.getJobId(), event.getRunId());
        pump();
    }

    /**
     * 补足空闲的执行槽位
     */
    public void pump() {
        int concurrency = workflowQueueService.getConcurrency();
        while (true) {
            int current = inFlight.get();
            if (current >= concurrency) {
                return;
            }
            if (!inFlight.compareAndSet(current, current + 1)) {
                continue;
            }
            try {
                workflowJobWorker.execute(this::drain);
            } catch (RejectedExecutionException ex) {
                inFlight.decrementAndGet();
                log.warn("Workflow job worker rejected drain task. inFlight={}, error={}", inFlight.get(), ex.getMessage());
                return;
            }
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    private void drain() {
        try {
            while (workflowQueueService.processOneWorkflowJob()) {
                log.debug("Workflow job processed, checking queue again");
            }
        } catch (Exception ex) {
            log.error("Workflow queue drain aborted. error={}", ex.getMessage(), ex);
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
