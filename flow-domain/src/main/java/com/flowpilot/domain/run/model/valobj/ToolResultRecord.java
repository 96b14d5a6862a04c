package com.flowpilot.domain.run.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已执行工具的结果，供后续调用的占位符引用
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolResultRecord {

    private String name;

    private Object result;
}
