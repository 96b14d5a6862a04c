package com.flowpilot.infrastructure.repository.store;

import com.flowpilot.domain.store.adapter.repository.IStoreEntryRepository;
import com.flowpilot.domain.store.model.entity.StoreEntryEntity;
import com.flowpilot.infrastructure.dao.StoreEntryDao;
import com.flowpilot.infrastructure.dao.po.StoreEntryPO;
import com.flowpilot.types.enums.StoreScopeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 存储仓储实现
 */
@Repository
public class StoreEntryRepositoryImpl implements IStoreEntryRepository {

    private final StoreEntryDao storeEntryDao;

    public StoreEntryRepositoryImpl(StoreEntryDao storeEntryDao) {
        this.storeEntryDao = storeEntryDao;
    }

    @Override
    public boolean upsert(StoreEntryEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        StoreEntryPO po = toPO(entity);
        po.setUpdatedAt(now);
        if (storeEntryDao.updateValue(po) > 0) {
            return false;
        }
        po.setCreatedAt(now);
        storeEntryDao.insert(po);
        entity.setId(po.getId());
        return true;
    }

    @Override
    public StoreEntryEntity find(StoreScopeEnum scope, String scopeId, String storeName, String key) {
        if (StringUtils.isAnyBlank(scopeId, storeName, key)) {
            return null;
        }
        return toEntity(storeEntryDao.selectOne(scope.getCode(), scopeId, storeName, key));
    }

    @Override
    public List<StoreEntryEntity> findByPrefix(StoreScopeEnum scope, String scopeId, String storeName, String prefix) {
        return storeEntryDao.selectByPrefix(scope.getCode(), scopeId, storeName, StringUtils.defaultString(prefix))
                .stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<String> listStoreNames(StoreScopeEnum scope, String scopeId) {
        return storeEntryDao.selectStoreNames(scope.getCode(), scopeId);
    }

    @Override
    public int deleteStore(StoreScopeEnum scope, String scopeId, String storeName) {
        return storeEntryDao.deleteStore(scope.getCode(), scopeId, storeName);
    }

    private StoreEntryEntity toEntity(StoreEntryPO po) {
        if (po == null) {
            return null;
        }
        StoreEntryEntity entity = new StoreEntryEntity();
        entity.setId(po.getId());
        entity.setScope(StoreScopeEnum.fromCode(po.getScope()));
        entity.setScopeId(po.getScopeId());
        entity.setStoreName(po.getStoreName());
        entity.setEntryKey(po.getEntryKey());
        entity.setEntryValue(po.getEntryValue());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private StoreEntryPO toPO(StoreEntryEntity entity) {
        return StoreEntryPO.builder()
                .id(entity.getId())
                .scope(entity.getScope().getCode())
                .scopeId(entity.getScopeId())
                .storeName(entity.getStoreName())
                .entryKey(entity.getEntryKey())
                .entryValue(entity.getEntryValue())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
