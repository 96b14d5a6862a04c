package com.flowpilot.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent 存储条目 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreEntryPO {

    private Long id;

    private String scope;

    private String scopeId;

    private String storeName;

    private String entryKey;

    private String entryValue;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
