package com.flowpilot.domain.agent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对话消息。role 取值 user / assistant / tool。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LlmMessage {

    private String role;

    private String content;

    public static LlmMessage user(String content) {
        return new LlmMessage("user", content);
    }

    public static LlmMessage assistant(String content) {
        return new LlmMessage("assistant", content);
    }

    public static LlmMessage tool(String content) {
        return new LlmMessage("tool", content);
    }
}
