package com.flowpilot.domain.tool.service;

import com.flowpilot.domain.run.model.valobj.PendingRequest;
import com.flowpilot.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工具结果分类：失败判定与"需要用户输入"判定，纯函数，不抛异常。
 */
@Service
public class ToolOutcomeClassifier {

    private static final Set<String> ASK_TOOLS = Set.of("ask_user", "request_user_help", "ask_credentials");
    private static final String FORMAT_RESPONSE = "format_response";
    private static final int FAILURE_MESSAGE_MAX = 100;

    /**
     * 失败判定，按顺序：
     * 非对象 → false；error 为非空白字符串 → true；exitCode 为非 0 数字 → true；
     * statusCode (缺省取 status) 为 400-599 的数字 → true；其余 → false。
     */
    public boolean isFailure(Object result) {
        if (!(result instanceof Map<?, ?> map)) {
            return false;
        }
        if (map.get("error") instanceof String error && StringUtils.isNotBlank(error)) {
            return true;
        }
        if (map.get("exitCode") instanceof Number exitCode && exitCode.doubleValue() != 0D) {
            return true;
        }
        Object status = map.get("statusCode") != null ? map.get("statusCode") : map.get("status");
        if (status instanceof Number code) {
            double value = code.doubleValue();
            return value >= 400D && value <= 599D;
        }
        return false;
    }

    /**
     * 是否需要挂起等待用户：
     * 提问类工具返回 waitingForUser=true 或带 options 数组；
     * format_response 返回 formatted=true 且 needsInput 非空。
     */
    public boolean isWaitingForInput(String toolName, Object result) {
        if (toolName == null || !(result instanceof Map<?, ?> map)) {
            return false;
        }
        if (ASK_TOOLS.contains(toolName)) {
            return Boolean.TRUE.equals(map.get("waitingForUser")) || map.get("options") instanceof List<?>;
        }
        if (FORMAT_RESPONSE.equals(toolName)) {
            return Boolean.TRUE.equals(map.get("formatted"))
                    && map.get("needsInput") instanceof String needsInput
                    && StringUtils.isNotBlank(needsInput);
        }
        return false;
    }

    public PendingRequest extractPendingRequest(String toolName, Object result) {
        PendingRequest request = new PendingRequest();
        request.setToolName(toolName);
        if (!(result instanceof Map<?, ?> map)) {
            request.setQuestion(Constants.DEFAULT_ASK_QUESTION);
            return request;
        }
        String question = firstText(map, "question", "needsInput", "message");
        request.setQuestion(StringUtils.defaultIfBlank(question, Constants.DEFAULT_ASK_QUESTION));
        List<String> options = texts(map.get("options"));
        if (options.isEmpty()) {
            options = texts(map.get("suggestions"));
        }
        request.setOptions(options);
        request.setType(firstText(map, "type"));
        request.setReason(firstText(map, "reason"));
        return request;
    }

    /**
     * 失败摘要，用于轨迹里的工具调用记录。
     */
    public String failureMessage(Object result) {
        if (!(result instanceof Map<?, ?> map)) {
            return null;
        }
        String message = null;
        if (map.get("error") instanceof String error && StringUtils.isNotBlank(error)) {
            message = error.trim();
        } else if (map.get("exitCode") instanceof Number exitCode && exitCode.doubleValue() != 0D) {
            message = "exitCode " + exitCode;
        } else {
            Object status = map.get("statusCode") != null ? map.get("statusCode") : map.get("status");
            if (status instanceof Number code) {
                message = "HTTP status " + code;
            }
        }
        return message == null ? null : StringUtils.abbreviate(message, FAILURE_MESSAGE_MAX);
    }

    private String firstText(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof String text && StringUtils.isNotBlank(text)) {
                return text.trim();
            }
        }
        return null;
    }

    private List<String> texts(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && StringUtils.isNotBlank(String.valueOf(item))) {
                    result.add(String.valueOf(item));
                }
            }
        }
        return result;
    }
}
