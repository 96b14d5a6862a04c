package com.flowpilot.infrastructure.ai;

import com.flowpilot.domain.agent.adapter.gateway.ILlmGateway;
import com.flowpilot.domain.agent.model.valobj.LlmMessage;
import com.flowpilot.domain.agent.model.valobj.LlmRequest;
import com.flowpilot.domain.agent.model.valobj.LlmResponse;
import com.flowpilot.domain.agent.model.valobj.LlmToolCall;
import com.flowpilot.domain.agent.model.valobj.LlmToolSpec;
import com.flowpilot.infrastructure.util.JsonCodec;
import com.flowpilot.types.enums.ResponseCode;
import com.flowpilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 Spring AI ChatClient 的大模型网关。
 * <p>
 * 工具调用使用 JSON 文本协议：模型需要调用工具时只返回
 * {@code {"toolCalls":[{"name":"...","arguments":{...}}]}}，否则返回普通文本。
 * llmConfigId 指向同名 ChatModel Bean 时使用该模型，否则使用默认模型。
 * </p>
 */
@Slf4j
@Component
public class SpringAiLlmGateway implements ILlmGateway {

    private static final String TOOL_PROTOCOL = "\n\nYou can call these tools:\n%s\n"
            + "To call tools, reply with ONLY a JSON object of the form "
            + "{\"toolCalls\":[{\"name\":\"<tool>\",\"arguments\":{...}}]}. "
            + "Otherwise reply with plain text, which is your final answer for this turn.";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ListableBeanFactory beanFactory;
    private final JsonCodec jsonCodec;

    public SpringAiLlmGateway(ObjectProvider<ChatModel> chatModelProvider,
                              ListableBeanFactory beanFactory,
                              JsonCodec jsonCodec) {
        this.chatModelProvider = chatModelProvider;
        this.beanFactory = beanFactory;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public LlmResponse call(LlmRequest request) {
        ChatModel chatModel = resolveChatModel(request.getLlmConfigId());
        ChatClient.ChatClientRequestSpec spec = ChatClient.builder(chatModel).build().prompt();
        String systemPrompt = buildSystemPrompt(request);
        if (StringUtils.isNotBlank(systemPrompt)) {
            spec = spec.system(systemPrompt);
        }
        String content = spec.user(buildTranscript(request.getMessages())).call().content();
        return parseResponse(content);
    }

    private ChatModel resolveChatModel(String llmConfigId) {
        if (StringUtils.isNotBlank(llmConfigId) && beanFactory.containsBean(llmConfigId)) {
            try {
                return beanFactory.getBean(llmConfigId, ChatModel.class);
            } catch (RuntimeException ex) {
                log.warn("ChatModel bean not usable, fallback to default. llmConfigId={}, error={}",
                        llmConfigId, ex.getMessage());
            }
        }
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new AppException(ResponseCode.LLM_UNAVAILABLE.getCode(), "No LLM provider configured");
        }
        return chatModel;
    }

    private String buildSystemPrompt(LlmRequest request) {
        String base = StringUtils.defaultString(request.getSystemPrompt());
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return base;
        }
        StringBuilder tools = new StringBuilder();
        for (LlmToolSpec tool : request.getTools()) {
            tools.append("- ").append(tool.getName());
            if (StringUtils.isNotBlank(tool.getDescription())) {
                tools.append(": ").append(tool.getDescription());
            }
            tools.append('\n');
        }
        return base + String.format(TOOL_PROTOCOL, tools.toString().trim());
    }

    private String buildTranscript(List<LlmMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return "Begin.";
        }
        if (messages.size() == 1) {
            return StringUtils.defaultIfBlank(messages.get(0).getContent(), "Begin.");
        }
        StringBuilder transcript = new StringBuilder();
        for (LlmMessage message : messages) {
            transcript.append('[').append(message.getRole()).append("]\n")
                    .append(StringUtils.defaultString(message.getContent()))
                    .append("\n\n");
        }
        return transcript.toString().trim();
    }

    LlmResponse parseResponse(String content) {
        if (StringUtils.isBlank(content)) {
            return LlmResponse.builder().content("").build();
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start || !content.contains("\"toolCalls\"")) {
            return LlmResponse.builder().content(content.trim()).build();
        }
        Map<String, Object> payload = tryReadMap(content.substring(start, end + 1));
        if (payload == null || !(payload.get("toolCalls") instanceof List<?> calls)) {
            return LlmResponse.builder().content(content.trim()).build();
        }
        List<LlmToolCall> toolCalls = new ArrayList<>();
        for (Object item : calls) {
            if (!(item instanceof Map<?, ?> call) || call.get("name") == null) {
                continue;
            }
            Map<String, Object> arguments = new LinkedHashMap<>();
            if (call.get("arguments") instanceof Map<?, ?> args) {
                args.forEach((key, value) -> arguments.put(String.valueOf(key), value));
            }
            toolCalls.add(LlmToolCall.builder()
                    .id("call-" + (toolCalls.size() + 1))
                    .name(String.valueOf(call.get("name")))
                    .arguments(arguments)
                    .build());
        }
        return LlmResponse.builder()
                .content(content.substring(0, start).trim())
                .toolCalls(toolCalls)
                .build();
    }

    private Map<String, Object> tryReadMap(String text) {
        try {
            return jsonCodec.readMap(text);
        } catch (AppException ex) {
            log.debug("LLM reply is not a tool call payload: {}", ex.getMessage());
            return null;
        }
    }
}
