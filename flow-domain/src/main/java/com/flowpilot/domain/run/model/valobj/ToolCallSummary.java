package com.flowpilot.domain.run.model.valobj;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 轨迹中的单次工具调用摘要
 */
@Value
@Builder
@Jacksonized
public class ToolCallSummary {

    String name;

    String argsSummary;

    String resultSummary;

    boolean failed;
}
