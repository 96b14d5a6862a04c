package com.flowpilot.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作流运行 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRunPO {

    /**
     * 主键 ID
     */
    private Long id;

    private Long workflowId;

    /**
     * 状态编码
     */
    private String status;

    private String initialInput;

    /**
     * 输出 (JSON)
     */
    private String output;

    /**
     * 执行轨迹 (JSON 数组)
     */
    private String trail;

    /**
     * 恢复游标 (JSON)
     */
    private String resumeCursor;

    /**
     * 图与 Agent 快照 (JSON)
     */
    private String workflowSnapshot;

    private Long retryOfRunId;

    private Integer retryAttempt;

    private Boolean cancelRequested;

    private Long activeJobId;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
