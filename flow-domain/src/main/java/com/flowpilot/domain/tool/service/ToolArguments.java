package com.flowpilot.domain.tool.service;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具参数读取。模型给出的参数类型不可靠，数字可能是字符串，列表可能缺失。
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    /**
     * 依次读取多个候选 key，返回第一个非空白的字符串值。
     */
    public static String string(Map<String, Object> args, String... keys) {
        if (args == null) {
            return null;
        }
        for (String key : keys) {
            Object value = args.get(key);
            if (value != null && StringUtils.isNotBlank(String.valueOf(value))) {
                return String.valueOf(value).trim();
            }
        }
        return null;
    }

    public static Long longValue(Map<String, Object> args, String... keys) {
        if (args == null) {
            return null;
        }
        for (String key : keys) {
            Object value = args.get(key);
            if (value instanceof Number number) {
                return number.longValue();
            }
            if (value != null && NumberUtils.isCreatable(String.valueOf(value).trim())) {
                return NumberUtils.createNumber(String.valueOf(value).trim()).longValue();
            }
        }
        return null;
    }

    public static Integer intValue(Map<String, Object> args, String key) {
        Long value = longValue(args, key);
        return value == null ? null : value.intValue();
    }

    public static boolean has(Map<String, Object> args, String key) {
        return args != null && args.containsKey(key);
    }

    /**
     * 读取字符串列表，非字符串元素转为字符串，空元素丢弃。
     */
    public static List<String> stringList(Map<String, Object> args, String key) {
        Object value = args == null ? null : args.get(key);
        if (!(value instanceof List<?> list)) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null && StringUtils.isNotBlank(String.valueOf(item))) {
                result.add(String.valueOf(item).trim());
            }
        }
        return result;
    }

    public static List<Object> list(Map<String, Object> args, String key) {
        Object value = args == null ? null : args.get(key);
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return Collections.emptyList();
    }

    public static Map<String, Object> map(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (k != null) {
                    copy.put(String.valueOf(k), v);
                }
            });
            return copy;
        }
        return null;
    }

    public static Map<String, Object> error(String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", message);
        return result;
    }
}
