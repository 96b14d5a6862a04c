package com.flowpilot.domain.agent.adapter.gateway;

import com.flowpilot.domain.agent.model.valobj.LlmRequest;
import com.flowpilot.domain.agent.model.valobj.LlmResponse;

/**
 * 大模型网关。一次调用对应一次模型往返，工具循环由调用方负责。
 */
public interface ILlmGateway {

    LlmResponse call(LlmRequest request);
}
