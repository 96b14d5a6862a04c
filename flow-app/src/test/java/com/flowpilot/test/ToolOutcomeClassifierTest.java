package com.flowpilot.test;

import com.flowpilot.domain.run.model.valobj.PendingRequest;
import com.flowpilot.domain.tool.service.ToolOutcomeClassifier;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ToolOutcomeClassifierTest {

    private final ToolOutcomeClassifier classifier = new ToolOutcomeClassifier();

    @Test
    public void shouldClassifyFailures() {
        assertFalse(classifier.isFailure(null));
        assertFalse(classifier.isFailure("error"));
        assertFalse(classifier.isFailure(Map.of("error", "")));
        assertFalse(classifier.isFailure(Map.of("error", "   ")));
        assertTrue(classifier.isFailure(Map.of("error", "x")));
        assertFalse(classifier.isFailure(Map.of("exitCode", 0)));
        assertTrue(classifier.isFailure(Map.of("exitCode", 2)));
        assertTrue(classifier.isFailure(Map.of("statusCode", 404)));
        assertFalse(classifier.isFailure(Map.of("statusCode", 301)));
        assertTrue(classifier.isFailure(Map.of("status", 503)));
        assertFalse(classifier.isFailure(Map.of("status", "failed")));
        assertFalse(classifier.isFailure(Map.of("statusCode", 200, "status", 500)));
    }

    @Test
    public void shouldDetectWaitingForAskTools() {
        assertTrue(classifier.isWaitingForInput("ask_user", Map.of("waitingForUser", true)));
        assertTrue(classifier.isWaitingForInput("request_user_help", Map.of("options", List.of("a"))));
        assertTrue(classifier.isWaitingForInput("ask_credentials", Map.of("waitingForUser", true)));
        assertFalse(classifier.isWaitingForInput("ask_user", Map.of("waitingForUser", false)));
        assertFalse(classifier.isWaitingForInput("get_store", Map.of("waitingForUser", true)));
        assertFalse(classifier.isWaitingForInput("ask_user", "yes"));
    }

    @Test
    public void shouldDetectWaitingForFormatResponseWithNeedsInput() {
        Map<String, Object> waiting = new LinkedHashMap<>();
        waiting.put("formatted", true);
        waiting.put("needsInput", "Which region?");
        Map<String, Object> done = new LinkedHashMap<>();
        done.put("formatted", true);
        done.put("needsInput", " ");

        assertTrue(classifier.isWaitingForInput("format_response", waiting));
        assertFalse(classifier.isWaitingForInput("format_response", done));
    }

    @Test
    public void shouldExtractPendingRequest() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("waitingForUser", true);
        result.put("question", "Need an API key");
        result.put("type", "credentials");
        result.put("reason", "Calling the billing API");
        result.put("suggestions", List.of("Paste the key", "Skip"));

        PendingRequest request = classifier.extractPendingRequest("request_user_help", result);

        assertEquals("Need an API key", request.getQuestion());
        assertEquals(List.of("Paste the key", "Skip"), request.getOptions());
        assertEquals("credentials", request.getType());
        assertEquals("Calling the billing API", request.getReason());
        assertEquals("request_user_help", request.getToolName());
    }

    @Test
    public void shouldSummarizeFailureMessage() {
        assertEquals("exitCode 3", classifier.failureMessage(Map.of("exitCode", 3)));
        assertEquals("HTTP status 500", classifier.failureMessage(Map.of("statusCode", 500)));
        assertNull(classifier.failureMessage(Map.of("ok", true)));
        String longError = "x".repeat(300);
        assertEquals(100, classifier.failureMessage(Map.of("error", longError)).length());
    }
}
