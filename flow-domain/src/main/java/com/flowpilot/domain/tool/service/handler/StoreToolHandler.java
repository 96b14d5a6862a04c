package com.flowpilot.domain.tool.service.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.domain.store.adapter.repository.IStoreEntryRepository;
import com.flowpilot.domain.store.model.entity.StoreEntryEntity;
import com.flowpilot.domain.tool.adapter.handler.IToolHandler;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.types.enums.StoreScopeEnum;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flowpilot.domain.tool.service.ToolArguments.error;
import static com.flowpilot.domain.tool.service.ToolArguments.string;

/**
 * Agent 自管存储工具。store 在第一次 put_store 时隐式创建。
 */
@Component
public class StoreToolHandler implements IToolHandler {

    private final IStoreEntryRepository storeEntryRepository;
    private final ObjectMapper objectMapper;

    public StoreToolHandler(IStoreEntryRepository storeEntryRepository, ObjectMapper objectMapper) {
        this.storeEntryRepository = storeEntryRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Set<String> toolNames() {
        return Set.of("create_store", "put_store", "get_store", "query_store", "list_stores", "delete_store");
    }

    @Override
    public String describe(String toolName) {
        return "Agent key-value store (" + toolName + "). Args: scope (agent|job), scopeId, storeName, key?, value?, prefix?";
    }

    @Override
    public Object execute(String toolName, Map<String, Object> args, ToolExecutionContext context) {
        StoreScopeEnum scope;
        try {
            scope = StoreScopeEnum.fromCode(string(args, "scope") == null ? "agent" : string(args, "scope"));
        } catch (IllegalArgumentException ex) {
            return error("scope must be agent or job");
        }
        String scopeId = string(args, "scopeId");
        if (scopeId == null && context != null && context.getAgentId() != null && scope == StoreScopeEnum.AGENT) {
            scopeId = String.valueOf(context.getAgentId());
        }
        if (scopeId == null) {
            return error("scopeId required");
        }
        switch (toolName) {
            case "create_store":
                return createStore(args);
            case "put_store":
                return putStore(scope, scopeId, args);
            case "get_store":
                return getStore(scope, scopeId, args);
            case "query_store":
                return queryStore(scope, scopeId, args);
            case "list_stores":
                return listStores(scope, scopeId);
            default:
                return deleteStore(scope, scopeId, args);
        }
    }

    private Map<String, Object> createStore(Map<String, Object> args) {
        if (string(args, "name", "storeName") == null) {
            return error("scopeId and name required");
        }
        return message("Store is created when you first put_store a key. No separate create needed.");
    }

    private Map<String, Object> putStore(StoreScopeEnum scope, String scopeId, Map<String, Object> args) {
        String storeName = string(args, "storeName");
        String key = string(args, "key");
        if (storeName == null || key == null) {
            return error("storeName and key required");
        }
        StoreEntryEntity entry = new StoreEntryEntity();
        entry.setScope(scope);
        entry.setScopeId(scopeId);
        entry.setStoreName(storeName);
        entry.setEntryKey(key);
        entry.setEntryValue(toText(args.get("value")));
        entry.setCreatedAt(LocalDateTime.now());
        entry.setUpdatedAt(LocalDateTime.now());
        boolean inserted = storeEntryRepository.upsert(entry);
        return message(inserted ? "Stored." : "Updated.");
    }

    private Map<String, Object> getStore(StoreScopeEnum scope, String scopeId, Map<String, Object> args) {
        StoreEntryEntity entry = storeEntryRepository.find(scope, scopeId, string(args, "storeName"), string(args, "key"));
        if (entry == null) {
            return error("Key not found");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("value", entry.getEntryValue());
        return result;
    }

    private Map<String, Object> queryStore(StoreScopeEnum scope, String scopeId, Map<String, Object> args) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (StoreEntryEntity entry : storeEntryRepository.findByPrefix(scope, scopeId,
                string(args, "storeName"), string(args, "prefix"))) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("key", entry.getEntryKey());
            item.put("value", entry.getEntryValue());
            entries.add(item);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("entries", entries);
        return result;
    }

    private Map<String, Object> listStores(StoreScopeEnum scope, String scopeId) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("stores", storeEntryRepository.listStoreNames(scope, scopeId));
        return result;
    }

    private Map<String, Object> deleteStore(StoreScopeEnum scope, String scopeId, Map<String, Object> args) {
        String storeName = string(args, "storeName");
        if (storeName == null) {
            return error("storeName required");
        }
        storeEntryRepository.deleteStore(scope, scopeId, storeName);
        return message("Store deleted.");
    }

    private String toText(Object value) {
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value == null ? "" : value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("value is not serializable", ex);
        }
    }

    private Map<String, Object> message(String text) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", text);
        return result;
    }
}
