package com.flowpilot.infrastructure.dao;

import com.flowpilot.infrastructure.dao.po.StoreEntryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Agent 存储 DAO
 */
@Mapper
public interface StoreEntryDao {

    int insert(StoreEntryPO po);

    int updateValue(StoreEntryPO po);

    StoreEntryPO selectOne(@Param("scope") String scope,
                           @Param("scopeId") String scopeId,
                           @Param("storeName") String storeName,
                           @Param("entryKey") String entryKey);

    List<StoreEntryPO> selectByPrefix(@Param("scope") String scope,
                                      @Param("scopeId") String scopeId,
                                      @Param("storeName") String storeName,
                                      @Param("prefix") String prefix);

    List<String> selectStoreNames(@Param("scope") String scope, @Param("scopeId") String scopeId);

    int deleteStore(@Param("scope") String scope,
                    @Param("scopeId") String scopeId,
                    @Param("storeName") String storeName);
}
