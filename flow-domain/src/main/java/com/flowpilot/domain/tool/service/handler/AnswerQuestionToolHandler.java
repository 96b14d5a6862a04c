package com.flowpilot.domain.tool.service.handler;

import com.flowpilot.domain.agent.adapter.gateway.ILlmGateway;
import com.flowpilot.domain.agent.model.valobj.LlmMessage;
import com.flowpilot.domain.agent.model.valobj.LlmRequest;
import com.flowpilot.domain.agent.model.valobj.LlmResponse;
import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flowpilot.domain.tool.service.ToolArguments.error;
import static com.flowpilot.domain.tool.service.ToolArguments.string;

/**
 * answer_question：不带工具的单次模型问答。
 */
@Component
public class AnswerQuestionToolHandler implements IToolHandler {

    private static final String SYSTEM_PROMPT = "Answer the question concisely and accurately. "
            + "If context is given, base the answer on it.";

    private final ILlmGateway llmGateway;

    public AnswerQuestionToolHandler(ILlmGateway llmGateway) {
        this.llmGateway = llmGateway;
    }

    @Override
    public Set<String> toolNames() {
        return Set.of("answer_question");
    }

    @Override
    public String describe(String toolName) {
        return "Answer a question with the language model. Args: question, context?";
    }

    @Override
    public Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context) {
        String question = string(args, "question", "query");
        if (question == null) {
            return error("question is required");
        }
        String extra = string(args, "context");
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.user(extra == null ? question : "Context:\n" + extra + "\n\nQuestion: " + question));
        LlmResponse response = llmGateway.call(LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .messages(messages)
                .build());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("answer", response == null ? "" : response.getContent());
        return result;
    }
}
