/**
 * Run 领域 - 工作流运行
 *
 * <p>职责：按图推进节点、挂起等待用户、从恢复游标继续、协作式取消。</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.flowpilot.domain.run.model.entity.WorkflowRunEntity}</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>WorkflowRun - 运行记录，含轨迹与恢复游标</li>
 *   <li>WorkflowJob - 执行队列中的任务</li>
 *   <li>ExecutionLog - 运行调试日志</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>WorkflowGraphRunner - 图执行器</li>
 *   <li>ExecutionLogRecorder - 执行日志记录</li>
 * </ul>
 */
package com.flowpilot.domain.run;
