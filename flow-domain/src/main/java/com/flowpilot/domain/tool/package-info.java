/**
 * Tool 领域 - 工具调用
 *
 * <p>职责：按名称分发工具调用、解析跨调用占位符、判定工具结果是失败还是需要用户输入。</p>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>ToolDispatcher - 工具分发</li>
 *   <li>ToolReferenceResolver - {{tool.path}} 占位符解析</li>
 *   <li>ToolOutcomeClassifier - 结果分类</li>
 * </ul>
 *
 * <p>具体工具由 {@link com.flowpilot.domain.tool.adapter.handler.IToolHandler} 实现，以 Spring Bean 注册。</p>
 */
package com.flowpilot.domain.tool;
