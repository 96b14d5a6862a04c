package com.flowpilot.api.dto;

import lombok.Data;

/**
 * 启动运行请求 DTO。
 */
@Data
public class RunStartRequestDTO {

    private String input;
}
