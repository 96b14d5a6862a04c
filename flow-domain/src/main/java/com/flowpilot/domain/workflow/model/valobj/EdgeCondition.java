package com.flowpilot.domain.workflow.model.valobj;

import com.flowpilot.types.enums.EdgeConditionTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 条件边的判定条件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EdgeCondition {

    /** message_type / content_contains */
    private String type;

    private String value;

    /**
     * 判定上一节点输出是否满足条件。
     *
     * @param output  原始输出
     * @param content 输出的文本形式 (字符串原样，其他为 JSON)
     */
    public boolean matches(Object output, String content) {
        EdgeConditionTypeEnum conditionType;
        try {
            conditionType = EdgeConditionTypeEnum.fromCode(type);
        } catch (IllegalArgumentException ex) {
            return true;
        }
        if (conditionType == null || value == null) {
            return true;
        }
        String text = content == null ? "" : content;
        if (conditionType == EdgeConditionTypeEnum.MESSAGE_TYPE) {
            if (text.equals(value)) {
                return true;
            }
            return output instanceof Map<?, ?> map && Objects.equals(map.get("type"), value);
        }
        return text.toLowerCase(Locale.ROOT).contains(value.toLowerCase(Locale.ROOT));
    }
}
