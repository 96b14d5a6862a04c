package com.flowpilot.domain.run.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 挂起时向用户提出的请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingRequest {

    private String question;

    @Builder.Default
    private List<String> options = new ArrayList<>();

    /** request_user_help 的求助类型 */
    private String type;

    private String reason;

    /** 触发挂起的工具名，人工节点为空 */
    private String toolName;
}
