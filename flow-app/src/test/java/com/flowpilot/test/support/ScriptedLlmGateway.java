package com.flowpilot.test.support;

import com.flowpilot.domain.agent.adapter.gateway.ILlmGateway;
import com.flowpilot.domain.agent.model.valobj.LlmMessage;
import com.flowpilot.domain.agent.model.valobj.LlmRequest;
import com.flowpilot.domain.agent.model.valobj.LlmResponse;
import com.flowpilot.domain.agent.model.valobj.LlmToolCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 可编排的模型网关：默认回显最后一条用户消息，也可以逐次指定响应。
 */
public class ScriptedLlmGateway implements ILlmGateway {

    private final List<LlmRequest> requests = new ArrayList<>();
    private final List<LlmResponse> scripted = new ArrayList<>();
    private Function<LlmRequest, LlmResponse> fallback = request -> LlmResponse.builder()
            .content("echo: " + lastUserMessage(request))
            .build();

    @Override
    public synchronized LlmResponse call(LlmRequest request) {
        requests.add(LlmRequest.builder()
                .llmConfigId(request.getLlmConfigId())
                .systemPrompt(request.getSystemPrompt())
                .messages(new ArrayList<>(request.getMessages()))
                .tools(new ArrayList<>(request.getTools()))
                .build());
        if (!scripted.isEmpty()) {
            return scripted.remove(0);
        }
        return fallback.apply(request);
    }

    public ScriptedLlmGateway thenReply(String content) {
        scripted.add(LlmResponse.builder().content(content).build());
        return this;
    }

    public ScriptedLlmGateway thenCallTool(String toolName, Map<String, Object> arguments) {
        LlmToolCall call = LlmToolCall.builder().id("call-" + (scripted.size() + 1)).name(toolName).arguments(arguments).build();
        scripted.add(LlmResponse.builder().toolCalls(new ArrayList<>(List.of(call))).build());
        return this;
    }

    public ScriptedLlmGateway otherwise(Function<LlmRequest, LlmResponse> fallback) {
        this.fallback = fallback;
        return this;
    }

    public synchronized List<LlmRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    public static String lastUserMessage(LlmRequest request) {
        String last = "";
        for (LlmMessage message : request.getMessages()) {
            if ("user".equals(message.getRole())) {
                last = message.getContent();
            }
        }
        return last;
    }
}
