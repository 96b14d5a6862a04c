package com.flowpilot.domain.store.adapter.repository;

import com.flowpilot.domain.store.model.entity.StoreEntryEntity;
import com.flowpilot.types.enums.StoreScopeEnum;

import java.util.List;

/**
 * Agent 存储仓储接口
 */
public interface IStoreEntryRepository {

    /**
     * 写入条目，已存在则覆盖。返回 true 表示新增。
     */
    boolean upsert(StoreEntryEntity entity);

    StoreEntryEntity find(StoreScopeEnum scope, String scopeId, String storeName, String key);

    /**
     * 按 key 前缀查询，prefix 为空时返回全部
     */
    List<StoreEntryEntity> findByPrefix(StoreScopeEnum scope, String scopeId, String storeName, String prefix);

    List<String> listStoreNames(StoreScopeEnum scope, String scopeId);

    int deleteStore(StoreScopeEnum scope, String scopeId, String storeName);
}
