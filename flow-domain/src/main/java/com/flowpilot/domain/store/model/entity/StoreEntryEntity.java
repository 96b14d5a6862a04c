package com.flowpilot.domain.store.model.entity;

import com.flowpilot.types.enums.StoreScopeEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Agent 自管存储条目
 */
@Data
public class StoreEntryEntity {

    private Long id;

    private StoreScopeEnum scope;

    /** Agent ID 或改进任务 ID */
    private String scopeId;

    private String storeName;

    private String entryKey;

    private String entryValue;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
