package com.flowpilot.test;

import com.flowpilot.domain.tool.model.exception.ToolExecutionException;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.tool.service.ToolDispatcher;
import com.flowpilot.domain.tool.service.handler.ConversationToolHandler;
import com.flowpilot.test.support.StubToolHandler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ToolDispatcherTest {

    @Test
    public void shouldReturnErrorForUnknownTool() {
        ToolDispatcher dispatcher = new ToolDispatcher(List.of(new ConversationToolHandler()));

        Object result = dispatcher.execute("does_not_exist", Map.of(), ToolExecutionContext.empty());

        assertEquals(Map.of("error", "Unknown tool: does_not_exist"), result);
        assertFalse(dispatcher.hasTool("does_not_exist"));
        assertTrue(dispatcher.hasTool("ask_user"));
    }

    @Test
    public void shouldTreatNonMapArgumentsAsEmpty() {
        StubToolHandler echo = new StubToolHandler("echo", args -> Map.of("size", args.size()));
        ToolDispatcher dispatcher = new ToolDispatcher(List.of(echo));

        Object fromNull = dispatcher.execute("echo", null, null);
        Object fromString = dispatcher.execute("echo", "not a map", null);

        assertEquals(Map.of("size", 0), fromNull);
        assertEquals(Map.of("size", 0), fromString);
    }

    @Test
    public void shouldWrapHandlerExceptionWithToolName() {
        StubToolHandler broken = new StubToolHandler("broken", args -> {
            throw new IllegalStateException("disk full");
        });
        ToolDispatcher dispatcher = new ToolDispatcher(List.of(broken));

        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> dispatcher.execute("broken", Map.of(), ToolExecutionContext.empty()));

        assertEquals("broken: disk full", ex.getMessage());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    public void shouldDescribeOnlyRegisteredTools() {
        ToolDispatcher dispatcher = new ToolDispatcher(List.of(new ConversationToolHandler()));

        assertEquals(1, dispatcher.toolSpecs(List.of("ask_user", "missing")).size());
        assertEquals("ask_user", dispatcher.toolSpecs(List.of("ask_user")).get(0).getName());
    }

    @Test
    public void shouldBuildAskUserResultThatPauses() {
        ToolDispatcher dispatcher = new ToolDispatcher(List.of(new ConversationToolHandler()));

        Object result = dispatcher.execute("ask_user", Map.of("question", "Proceed?", "options", List.of("yes", "no")), null);

        Map<?, ?> map = (Map<?, ?>) result;
        assertEquals(true, map.get("waitingForUser"));
        assertEquals("Proceed?", map.get("question"));
        assertEquals(List.of("yes", "no"), map.get("options"));
    }
}
