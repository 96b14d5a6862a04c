/**
 * Workflow 领域 - 工作流图定义
 *
 * <p>节点 + 有向边组成的图，边可携带条件；运行时使用 {@link com.flowpilot.domain.workflow.model.valobj.WorkflowGraph}
 * 作为不可变快照，运行期间对定义的修改不影响已启动的运行。</p>
 */
package com.flowpilot.domain.workflow;
