package com.flowpilot.domain.agent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 大模型请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmRequest {

    /** 模型配置 ID，可空 */
    private String llmConfigId;

    private String systemPrompt;

    @Builder.Default
    private List<LlmMessage> messages = new ArrayList<>();

    @Builder.Default
    private List<LlmToolSpec> tools = new ArrayList<>();
}
