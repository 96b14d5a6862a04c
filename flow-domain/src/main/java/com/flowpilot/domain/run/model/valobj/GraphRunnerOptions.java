package com.flowpilot.domain.run.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 图执行参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphRunnerOptions {

    /** 工作流未设置 maxRounds 时的默认轮次上限 */
    @Builder.Default
    private int defaultMaxRounds = 3;

    /** 单个 Agent 回合内最多的模型往返次数 */
    @Builder.Default
    private int maxToolIterations = 8;

    /** 共享上下文保留的最近回合数 */
    @Builder.Default
    private int recentTurns = 8;
}
