package com.flowpilot.domain.tool.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.domain.run.model.valobj.ToolResultRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 跨调用引用解析：把参数中的 {{toolName.path}} 替换为此前同名工具最近一次结果里的值。
 * <ul>
 *   <li>结果从后往前查找，同名取最新一次；</li>
 *   <li>路径先按全路径取值，取不到再依次去掉开头一段 (a.b.c → b.c → c)；</li>
 *   <li>整串恰好是一个占位符时保留原始类型，嵌在文本中时替换为字符串形式；</li>
 *   <li>解析不到的占位符原样保留。</li>
 * </ul>
 * 返回新的参数树，不修改入参。
 */
@Service
public class ToolReferenceResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*\\.\\s*([^}]+?)\\s*}}");

    private final ObjectMapper objectMapper;

    public ToolReferenceResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Object resolve(Object args, List<ToolResultRecord> priorResults) {
        List<ToolResultRecord> prior = priorResults == null ? new ArrayList<>() : priorResults;
        return resolveValue(args, prior);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> resolveArgs(Map<String, Object> args, List<ToolResultRecord> priorResults) {
        if (args == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) resolve(args, priorResults);
    }

    private Object resolveValue(Object value, List<ToolResultRecord> prior) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), resolveValue(entry.getValue(), prior));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(resolveValue(item, prior));
            }
            return copy;
        }
        if (value instanceof String text) {
            return resolveString(text, prior);
        }
        return value;
    }

    private Object resolveString(String text, List<ToolResultRecord> prior) {
        if (prior.isEmpty() || !text.contains("{{")) {
            return text;
        }
        Matcher whole = PLACEHOLDER.matcher(text.trim());
        if (whole.matches()) {
            Optional<Object> resolved = lookup(whole.group(1), whole.group(2), prior);
            return resolved.isPresent() ? resolved.get() : text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            Optional<Object> resolved = lookup(matcher.group(1), matcher.group(2), prior);
            String replacement = resolved.map(this::stringify).orElse(matcher.group(0));
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private Optional<Object> lookup(String toolName, String path, List<ToolResultRecord> prior) {
        for (int i = prior.size() - 1; i >= 0; i--) {
            ToolResultRecord record = prior.get(i);
            if (record != null && toolName.equals(record.getName())) {
                return nested(record.getResult(), path.trim());
            }
        }
        return Optional.empty();
    }

    private Optional<Object> nested(Object root, String path) {
        String[] segments = path.split("\\.");
        for (int start = 0; start < segments.length; start++) {
            Optional<Object> value = walk(root, Arrays.copyOfRange(segments, start, segments.length));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private Optional<Object> walk(Object root, String[] segments) {
        Object current = root;
        for (String raw : segments) {
            String segment = raw.trim();
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment)) {
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return Optional.empty();
            }
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    private boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private String stringify(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }
}
