package com.flowpilot.domain.agent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 暴露给模型的工具说明
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LlmToolSpec {

    private String name;

    private String description;
}
