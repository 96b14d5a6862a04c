package com.flowpilot.config;

import com.flowpilot.domain.run.model.valobj.GraphRunnerOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 图执行参数装配。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RunnerProperties.class)
public class RunnerConfig {

    @Bean
    public GraphRunnerOptions graphRunnerOptions(RunnerProperties properties) {
        GraphRunnerOptions options = GraphRunnerOptions.builder()
                .defaultMaxRounds(Math.max(properties.getDefaultMaxRounds(), 1))
                .maxToolIterations(Math.max(properties.getMaxToolIterations(), 1))
                .recentTurns(Math.max(properties.getRecentTurns(), 1))
                .build();
        log.info("Graph runner configured. defaultMaxRounds={}, maxToolIterations={}, recentTurns={}",
                options.getDefaultMaxRounds(), options.getMaxToolIterations(), options.getRecentTurns());
        return options;
    }

}
