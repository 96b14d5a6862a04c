package com.flowpilot.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.domain.store.adapter.repository.IStoreEntryRepository;
import com.flowpilot.domain.store.model.entity.StoreEntryEntity;
import com.flowpilot.domain.tool.model.valobj.ToolExecutionContext;
import com.flowpilot.domain.tool.service.handler.StoreToolHandler;
import com.flowpilot.types.enums.StoreScopeEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class StoreToolHandlerTest {

    private IStoreEntryRepository storeEntryRepository;
    private StoreToolHandler handler;

    @BeforeEach
    public void setUp() {
        this.storeEntryRepository = mock(IStoreEntryRepository.class);
        this.handler = new StoreToolHandler(storeEntryRepository, new ObjectMapper());
    }

    @Test
    public void shouldDefaultScopeIdToCurrentAgent() {
        when(storeEntryRepository.upsert(any())).thenReturn(true);
        ToolExecutionContext context = ToolExecutionContext.builder().agentId(12L).build();

        Object result = handler.execute("put_store",
                Map.of("storeName", "prefs", "key", "color", "value", Map.of("hex", "#fff")), context);

        ArgumentCaptor<StoreEntryEntity> captor = ArgumentCaptor.forClass(StoreEntryEntity.class);
        verify(storeEntryRepository).upsert(captor.capture());
        assertEquals(Map.of("message", "Stored."), result);
        assertEquals(StoreScopeEnum.AGENT, captor.getValue().getScope());
        assertEquals("12", captor.getValue().getScopeId());
        assertEquals("{\"hex\":\"#fff\"}", captor.getValue().getEntryValue());
    }

    @Test
    public void shouldRejectUnknownScope() {
        Object result = handler.execute("get_store", Map.of("scope", "team", "scopeId", "1"), ToolExecutionContext.empty());

        assertEquals(Map.of("error", "scope must be agent or job"), result);
    }

    @Test
    public void shouldRequireScopeIdForJobScope() {
        ToolExecutionContext context = ToolExecutionContext.builder().agentId(12L).build();

        Object result = handler.execute("list_stores", Map.of("scope", "job"), context);

        assertEquals(Map.of("error", "scopeId required"), result);
    }

    @Test
    public void shouldReportMissingKey() {
        Object result = handler.execute("get_store",
                Map.of("scopeId", "5", "storeName", "prefs", "key", "missing"), ToolExecutionContext.empty());

        assertEquals(Map.of("error", "Key not found"), result);
    }

    @Test
    public void shouldRequireStoreNameOnDelete() {
        Object result = handler.execute("delete_store", Map.of("scopeId", "5"), ToolExecutionContext.empty());

        assertEquals(Map.of("error", "storeName required"), result);
        verify(storeEntryRepository, never()).deleteStore(any(), any(), any());
    }
}
