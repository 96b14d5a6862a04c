/**
 * Store 领域 - Agent 自管的键值存储，按 Agent 或改进任务隔离。
 */
package com.flowpilot.domain.store;
