/**
 * Agent 领域 - Agent 定义与大模型网关
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>{@link com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity} - Agent 定义</li>
 * </ul>
 *
 * <h3>外部端口</h3>
 * <ul>
 *   <li>{@link com.flowpilot.domain.agent.adapter.gateway.ILlmGateway} - 单次大模型调用</li>
 * </ul>
 */
package com.flowpilot.domain.agent;
