package com.flowpilot.api.dto;

import lombok.Data;

/**
 * 回复挂起运行请求 DTO。
 */
@Data
public class RunRespondRequestDTO {

    private String response;
}
