package com.flowpilot.test;

import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.run.model.entity.WorkflowRunEntity;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.workflow.model.entity.WorkflowEntity;
import com.flowpilot.test.support.FlowTestFixture;
import com.flowpilot.test.support.InMemoryWorkflowJobRepository;
import com.flowpilot.test.support.StubToolHandler;
import com.flowpilot.trigger.application.command.WorkflowRunCommandService;
import com.flowpilot.trigger.application.common.RunViewAssembler;
import com.flowpilot.trigger.application.query.WorkflowRunQueryService;
import com.flowpilot.trigger.application.queue.WorkflowQueueService;
import com.flowpilot.trigger.tool.RunToolHandler;
import com.google.common.util.concurrent.Striped;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

import static com.flowpilot.test.support.FlowTestFixture.agentNode;
import static com.flowpilot.test.support.FlowTestFixture.toolNode;
import static com.flowpilot.test.support.FlowTestFixture.waitNode;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

public class RunToolHandlerTest {

    private FlowTestFixture fixture;
    private RunToolHandler handler;

    @BeforeEach
    public void setUp() {
        StubToolHandler httpGet = new StubToolHandler("http_get", args -> Map.of("statusCode", 500, "body", "oops"));
        fixture = new FlowTestFixture(httpGet);
        InMemoryWorkflowJobRepository jobRepository = new InMemoryWorkflowJobRepository();
        RunViewAssembler assembler = new RunViewAssembler();
        Striped<Lock> runLocks = Striped.lazyWeakLock(8);
        WorkflowQueueService queueService = new WorkflowQueueService(jobRepository, fixture.getRunRepository(),
                fixture.getRunner(), assembler, mock(ApplicationEventPublisher.class), runLocks, 2, 600000L);
        WorkflowRunCommandService commandService = new WorkflowRunCommandService(fixture.getWorkflowRepository(),
                fixture.getAgentRepository(), fixture.getRunRepository(), jobRepository, queueService,
                fixture.getRunner(), assembler, runLocks, 2);
        WorkflowRunQueryService queryService = new WorkflowRunQueryService(fixture.getRunRepository(),
                fixture.getLogRepository(), assembler);
        handler = new RunToolHandler(commandService, queryService, fixture.getWorkflowRepository(),
                fixture.getObjectMapper());
    }

    @Test
    public void shouldExecuteWorkflowByNameAndReportPendingRequest() {
        AgentDefinitionEntity planner = fixture.agent("Planner", "Plan.");
        fixture.workflow("approval", null,
                List.of(agentNode("plan", planner), waitNode("approve", "Approve?")), List.of());

        Map<?, ?> result = (Map<?, ?>) handler.execute("execute_workflow",
                Map.of("name", "approval", "input", "draft"), ToolExecutionContext.empty());

        assertEquals("waiting_for_user", result.get("status"));
        assertEquals(2, result.get("steps"));
        assertEquals("Approve?", ((Map<?, ?>) result.get("pendingRequest")).get("question"));
    }

    @Test
    public void shouldTurnBusinessErrorIntoErrorResult() {
        Object result = handler.execute("respond_to_run", Map.of("runId", 77, "response", "yes"),
                ToolExecutionContext.empty());

        assertEquals(Map.of("error", "Run not found"), result);
    }

    @Test
    public void shouldRequireRunId() {
        Object result = handler.execute("cancel_run", Map.of(), ToolExecutionContext.empty());

        assertEquals(Map.of("error", "runId is required"), result);
    }

    @Test
    public void shouldRespondToWaitingRun() {
        AgentDefinitionEntity planner = fixture.agent("Planner", "Plan.");
        fixture.workflow("approval", null,
                List.of(agentNode("plan", planner), waitNode("approve", "Approve?")), List.of());
        Map<?, ?> started = (Map<?, ?>) handler.execute("execute_workflow", Map.of("name", "approval"),
                ToolExecutionContext.empty());

        Map<?, ?> result = (Map<?, ?>) handler.execute("respond_to_run",
                Map.of("runId", started.get("runId"), "response", "approved"), ToolExecutionContext.empty());

        assertEquals("running", result.get("status"));
        assertEquals("Response recorded. The run will continue.", result.get("message"));
    }

    @Test
    public void shouldCollectFailingStepsForImprovement() {
        WorkflowEntity workflow = fixture.workflow("fetcher", null,
                List.of(toolNode("fetch", "http_get", Map.of("url", "https://example.com"))), List.of());
        WorkflowRunEntity run = fixture.getRunner().start(fixture.newRun(workflow, "go"), () -> false);

        Map<?, ?> result = (Map<?, ?>) handler.execute("get_run_for_improvement", Map.of("runId", run.getId()),
                ToolExecutionContext.empty());

        assertEquals(1, ((List<?>) result.get("failingSteps")).size());
        Map<?, ?> failing = (Map<?, ?>) ((List<?>) result.get("failingSteps")).get(0);
        assertEquals("HTTP status 500", failing.get("error"));
        Map<?, ?> snapshot = (Map<?, ?>) result.get("workflowSnapshot");
        assertEquals("fetcher", snapshot.get("name"));
        assertTrue(result.containsKey("currentWorkflowVersion"));
    }
}
