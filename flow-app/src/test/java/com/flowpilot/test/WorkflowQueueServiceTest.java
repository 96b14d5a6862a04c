package com.flowpilot.test;

import com.flowpilot.api.dto.WorkflowJobDTO;
import com.flowpilot.api.dto.WorkflowQueueStatusDTO;
import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.run.model.entity.WorkflowJobEntity;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;
import com.flowpilot.test.support.FlowTestFixture;
import com.flowpilot.test.support.InMemoryWorkflowJobRepository;
import com.flowpilot.trigger.application.common.RunViewAssembler;
import com.flowpilot.trigger.application.queue.WorkflowQueueService;
import com.flowpilot.types.enums.ResponseCode;
import com.flowpilot.types.enums.RunStatusEnum;
import com.flowpilot.types.enums.WorkflowJobStatusEnum;
import com.flowpilot.types.enums.WorkflowJobTypeEnum;
import com.flowpilot.types.exception.AppException;
import com.google.common.util.concurrent.Striped;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

import static com.flowpilot.test.support.FlowTestFixture.agentNode;
import static com.flowpilot.test.support.FlowTestFixture.edge;
import static com.flowpilot.test.support.FlowTestFixture.waitNode;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

public class WorkflowQueueServiceTest {

    private FlowTestFixture fixture;
    private InMemoryWorkflowJobRepository jobRepository;
    private WorkflowQueueService queueService;
    private Striped<Lock> runLocks;

    @BeforeEach
    public void setUp() {
        fixture = new FlowTestFixture();
        jobRepository = new InMemoryWorkflowJobRepository();
        runLocks = Striped.lazyWeakLock(8);
        queueService = new WorkflowQueueService(jobRepository, fixture.getRunRepository(), fixture.getRunner(),
                new RunViewAssembler(), mock(ApplicationEventPublisher.class), runLocks, 3, 1000L);
    }

    @Test
    public void shouldReturnFalseWhenQueueEmpty() {
        assertFalse(queueService.processOneWorkflowJob());
    }

    @Test
    public void shouldExecuteStartJobToCompletion() {
        WorkflowRunEntity run = fixture.newRun(soloWorkflow(), "hello");
        WorkflowJobEntity job = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);

        assertTrue(queueService.processOneWorkflowJob());

        assertEquals(WorkflowJobStatusEnum.COMPLETED, job.getStatus());
        assertTrue(job.getFinishedAt() != null);
        WorkflowRunEntity finished = fixture.getRunRepository().findById(run.getId());
        assertEquals(RunStatusEnum.COMPLETED, finished.getStatus());
        assertEquals("echo: hello", finished.getOutput().get("output"));
        assertNull(finished.getActiveJobId());
        assertFalse(queueService.processOneWorkflowJob());
    }

    @Test
    public void shouldNotClaimSecondJobForRunWithRunningJob() {
        WorkflowEntity workflow = soloWorkflow();
        WorkflowRunEntity busy = fixture.newRun(workflow, "busy");
        WorkflowRunEntity idle = fixture.newRun(workflow, "idle");
        WorkflowJobEntity inFlight = WorkflowJobEntity.queued(WorkflowJobTypeEnum.WORKFLOW_START, busy.getId(), null);
        inFlight.setStatus(WorkflowJobStatusEnum.RUNNING);
        inFlight.setStartedAt(LocalDateTime.now());
        jobRepository.save(inFlight);
        WorkflowJobEntity blocked = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_RESUME, busy.getId(), null);
        WorkflowJobEntity free = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, idle.getId(), null);

        assertTrue(queueService.processOneWorkflowJob());

        assertEquals(WorkflowJobStatusEnum.QUEUED, blocked.getStatus());
        assertEquals(WorkflowJobStatusEnum.COMPLETED, free.getStatus());
        assertFalse(queueService.processOneWorkflowJob());
    }

    @Test
    public void shouldFailJobWhenRunMissing() {
        WorkflowJobEntity job = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, 99L, null);

        queueService.processOneWorkflowJob();

        assertEquals(WorkflowJobStatusEnum.FAILED, job.getStatus());
        assertEquals("Run not found: 99", job.getError());
    }

    @Test
    public void shouldSkipJobForRunThatIsNoLongerRunning() {
        WorkflowRunEntity run = fixture.newRun(soloWorkflow(), "x");
        run.cancel();
        fixture.getRunRepository().update(run);
        WorkflowJobEntity job = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);

        queueService.processOneWorkflowJob();

        assertEquals(WorkflowJobStatusEnum.COMPLETED, job.getStatus());
        assertEquals(RunStatusEnum.CANCELLED, fixture.getRunRepository().findById(run.getId()).getStatus());
        assertTrue(fixture.getLlmGateway().getRequests().isEmpty());
    }

    @Test
    public void shouldUsePayloadReplyWhenCursorHasNone() {
        AgentDefinitionEntity planner = fixture.agent("Planner", "Plan.");
        AgentDefinitionEntity executor = fixture.agent("Executor", "Execute.");
        WorkflowEntity workflow = fixture.workflow("approval", null,
                List.of(agentNode("plan", planner), waitNode("approve", "Approve?"), agentNode("run", executor)),
                List.of(edge("plan", "approve"), edge("approve", "run")));
        WorkflowRunEntity run = fixture.getRunner().start(fixture.newRun(workflow, "go"), () -> false);
        run.acceptUserResponse("approved");
        run.getCursor().setUserResponse(null);
        fixture.getRunRepository().update(run);
        queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_RESUME, run.getId(),
                Map.of(WorkflowQueueService.RESUME_USER_RESPONSE, "approved via payload"));

        queueService.processOneWorkflowJob();

        WorkflowRunEntity finished = fixture.getRunRepository().findById(run.getId());
        assertEquals(RunStatusEnum.COMPLETED, finished.getStatus());
        assertEquals("approved via payload", finished.getTrail().get(2).getInput());
    }

    @Test
    public void shouldFailRunWhenJobThrows() {
        WorkflowRunEntity run = fixture.newRun(soloWorkflow(), "x");
        WorkflowJobEntity job = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_RESUME, run.getId(),
                Map.of(WorkflowQueueService.RESUME_USER_RESPONSE, "late reply"));

        queueService.processOneWorkflowJob();

        String expected = "Run " + run.getId() + " has no resume cursor";
        assertEquals(WorkflowJobStatusEnum.FAILED, job.getStatus());
        assertEquals(expected, job.getError());
        WorkflowRunEntity failed = fixture.getRunRepository().findById(run.getId());
        assertEquals(RunStatusEnum.FAILED, failed.getStatus());
        assertEquals(expected, failed.getOutput().get("error"));
        Map<?, ?> details = (Map<?, ?>) failed.getOutput().get("errorDetails");
        assertTrue(String.valueOf(details.get("stack")).startsWith("java.lang.IllegalStateException"));
        assertNull(failed.getActiveJobId());
    }

    @Test
    public void shouldWaitForRunLockBeforeTakingLease() throws InterruptedException {
        WorkflowRunEntity run = fixture.newRun(soloWorkflow(), "locked");
        WorkflowJobEntity job = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);
        Lock lock = runLocks.get(run.getId());
        Thread worker = new Thread(queueService::processOneWorkflowJob);

        lock.lock();
        try {
            worker.start();
            worker.join(300);
            assertTrue(worker.isAlive());
            assertNull(fixture.getRunRepository().findById(run.getId()).getActiveJobId());
            assertTrue(fixture.getLlmGateway().getRequests().isEmpty());
        } finally {
            lock.unlock();
        }
        worker.join(5000);

        assertFalse(worker.isAlive());
        assertEquals(WorkflowJobStatusEnum.COMPLETED, job.getStatus());
        WorkflowRunEntity finished = fixture.getRunRepository().findById(run.getId());
        assertEquals(RunStatusEnum.COMPLETED, finished.getStatus());
        assertNull(finished.getActiveJobId());
    }

    @Test
    public void shouldFailStaleJobsAndTheirRuns() {
        WorkflowRunEntity run = fixture.newRun(soloWorkflow(), "x");
        WorkflowJobEntity stale = WorkflowJobEntity.queued(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);
        stale.setStatus(WorkflowJobStatusEnum.RUNNING);
        stale.setStartedAt(LocalDateTime.now().minusMinutes(5));
        jobRepository.save(stale);

        int recovered = queueService.failStaleJobs();

        assertEquals(1, recovered);
        assertEquals(WorkflowJobStatusEnum.FAILED, stale.getStatus());
        assertEquals("Job exceeded 1000ms without finishing", stale.getError());
        WorkflowRunEntity failed = fixture.getRunRepository().findById(run.getId());
        assertEquals(RunStatusEnum.FAILED, failed.getStatus());
        assertEquals("Job exceeded 1000ms without finishing", failed.getOutput().get("error"));
    }

    @Test
    public void shouldReportQueueStatus() {
        WorkflowRunEntity run = fixture.newRun(soloWorkflow(), "x");
        queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);
        queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_RESUME, run.getId(), null);

        WorkflowQueueStatusDTO status = queueService.status();

        assertEquals(2, status.getQueued());
        assertEquals(0, status.getRunning());
        assertEquals(3, status.getConcurrency());
    }

    @Test
    public void shouldListJobsNewestFirstAndRejectUnknownStatus() {
        WorkflowRunEntity run = fixture.newRun(soloWorkflow(), "x");
        WorkflowJobEntity first = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_START, run.getId(), null);
        WorkflowJobEntity second = queueService.enqueue(WorkflowJobTypeEnum.WORKFLOW_RESUME, run.getId(), null);

        List<WorkflowJobDTO> jobs = queueService.listJobs("queued", 0);

        assertEquals(List.of(second.getId(), first.getId()), jobs.stream().map(WorkflowJobDTO::getId).toList());
        assertEquals("workflow_resume", jobs.get(0).getType());
        AppException ex = assertThrows(AppException.class, () -> queueService.listJobs("paused", 10));
        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldRejectUnknownJob() {
        AppException ex = assertThrows(AppException.class, () -> queueService.getJob(42L));

        assertEquals(ResponseCode.JOB_NOT_FOUND.getCode(), ex.getCode());
    }

    private WorkflowEntity soloWorkflow() {
        AgentDefinitionEntity solo = fixture.agent("Solo", "Work.");
        return fixture.workflow("solo", null, List.of(agentNode("a", solo)), List.of());
    }
}
