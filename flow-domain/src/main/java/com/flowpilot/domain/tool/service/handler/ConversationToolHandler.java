package com.flowpilot.domain.tool.service.handler;

import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.types.common.Constants;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flowpilot.domain.tool.service.ToolArguments.intValue;
import static com.flowpilot.domain.tool.service.ToolArguments.string;
import static com.flowpilot.domain.tool.service.ToolArguments.stringList;

/**
 * 对话类工具：ask_user / request_user_help / format_response。
 * 这些工具只构造结果，是否挂起由 ToolOutcomeClassifier 判定。
 */
@Component
public class ConversationToolHandler implements IToolHandler {

    public static final String ASK_USER = "ask_user";
    public static final String REQUEST_USER_HELP = "request_user_help";
    public static final String FORMAT_RESPONSE = "format_response";

    private static final int MAX_SUGGESTIONS = 50;

    @Override
    public Set<String> toolNames() {
        return Set.of(ASK_USER, REQUEST_USER_HELP, FORMAT_RESPONSE);
    }

    @Override
    public String describe(String toolName) {
        switch (toolName) {
            case ASK_USER:
                return "Ask the user a question and pause the run until they reply. Args: question, options?, reason?";
            case REQUEST_USER_HELP:
                return "Ask the user for help when blocked (credentials, approval, missing data). Args: type, message, question?, options?, suggestions?";
            default:
                return "Format the final answer for the user. Args: summary, needsInput? (set to pause and ask for input)";
        }
    }

    @Override
    public Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context) {
        switch (toolName) {
            case ASK_USER:
                return askUser(args);
            case REQUEST_USER_HELP:
                return requestUserHelp(args);
            default:
                return formatResponse(args);
        }
    }

    private Map<String, Object> askUser(Map<String, Object> args) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("waitingForUser", true);
        String question = string(args, "question", "message");
        result.put("question", question == null ? Constants.DEFAULT_ASK_QUESTION : question);
        List<String> options = stringList(args, "options");
        if (options != null && !options.isEmpty()) {
            result.put("options", options);
        }
        putIfPresent(result, "reason", string(args, "reason"));
        putIfPresent(result, "stepIndex", intValue(args, "stepIndex"));
        putIfPresent(result, "stepTotal", intValue(args, "stepTotal"));
        return result;
    }

    private Map<String, Object> requestUserHelp(Map<String, Object> args) {
        String type = string(args, "type");
        String message = string(args, "message");
        String question = string(args, "question");
        List<String> suggestions = stringList(args, "suggestions");
        if (suggestions != null && suggestions.size() > MAX_SUGGESTIONS) {
            suggestions = suggestions.subList(0, MAX_SUGGESTIONS);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("waitingForUser", true);
        result.put("question", question != null ? question : (message != null ? message : Constants.DEFAULT_ASK_QUESTION));
        result.put("type", type == null ? "other" : type);
        putIfPresent(result, "message", message);
        putIfPresent(result, "reason", message);
        if (suggestions != null && !suggestions.isEmpty()) {
            result.put("suggestions", suggestions);
        }
        List<String> options = stringList(args, "options");
        if (options != null && !options.isEmpty()) {
            result.put("options", options);
        }
        return result;
    }

    private Map<String, Object> formatResponse(Map<String, Object> args) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("formatted", true);
        result.put("summary", string(args, "summary", "text"));
        result.put("needsInput", string(args, "needsInput"));
        return result;
    }

    private void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
