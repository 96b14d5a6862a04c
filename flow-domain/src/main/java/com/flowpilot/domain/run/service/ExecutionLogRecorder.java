package com.flowpilot.domain.run.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.domain.run.adapter.repository.IExecutionLogRepository;
import com.flowpilot.domain.run.model.entity.ExecutionLogEntity;
import com.flowpilot.types.common.Constants;
import com.flowpilot.types.enums.ExecutionLogPhaseEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 运行调试日志写入。写入失败只告警，不影响运行本身。
 */
@Slf4j
@Service
public class ExecutionLogRecorder {

    private final IExecutionLogRepository executionLogRepository;
    private final ObjectMapper objectMapper;

    public ExecutionLogRecorder(IExecutionLogRepository executionLogRepository, ObjectMapper objectMapper) {
        this.executionLogRepository = executionLogRepository;
        this.objectMapper = objectMapper;
    }

    public void record(Long runId, ExecutionLogPhaseEnum phase, String label, Object payload) {
        if (runId == null) {
            return;
        }
        try {
            ExecutionLogEntity entity = new ExecutionLogEntity();
            entity.setRunId(runId);
            entity.setPhase(phase);
            entity.setLabel(label);
            entity.setPayload(truncate(serialize(payload)));
            entity.setCreatedAt(LocalDateTime.now());
            executionLogRepository.append(entity);
        } catch (RuntimeException ex) {
            log.warn("Execution log append failed. runId={}, phase={}, label={}, error={}",
                    runId, phase == null ? null : phase.getCode(), label, ex.getMessage());
        }
    }

    private String serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            return String.valueOf(payload);
        }
    }

    static String truncate(String text) {
        if (text == null || text.length() <= Constants.EXECUTION_LOG_PAYLOAD_MAX) {
            return text;
        }
        return text.substring(0, Constants.EXECUTION_LOG_PAYLOAD_MAX) + "…";
    }
}
