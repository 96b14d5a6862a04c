package com.flowpilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 图执行配置属性，前缀 flow.runner。
 */
@Data
@ConfigurationProperties(prefix = "flow.runner", ignoreInvalidFields = true)
public class RunnerProperties {

    /** 工作流未设置 maxRounds 时的默认轮次上限 */
    private Integer defaultMaxRounds = 3;

    /** 单个 Agent 回合内最多的模型往返次数 */
    private Integer maxToolIterations = 8;

    /** 自修复重试上限 */
    private Integer maxSelfFixRetries = 2;

    /** 共享上下文保留的最近回合数 */
    private Integer recentTurns = 8;

}
