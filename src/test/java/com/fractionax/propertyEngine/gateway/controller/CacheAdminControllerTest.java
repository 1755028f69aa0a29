package com.fractionax.propertyEngine.gateway.controller;

import com.fractionax.propertyEngine.cache.CacheStats;
import com.fractionax.propertyEngine.cache.ResponseCache;
import com.fractionax.propertyEngine.provider.ProviderResponseCaches;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = CacheAdminController.class)
class CacheAdminControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ResponseCache responseCache;

    @MockBean
    ProviderResponseCaches providerResponseCaches;

    @Test
    void stats() throws Exception {
        when(responseCache.stats()).thenReturn(new CacheStats(3, 10, 4, 1, 0));

        mvc.perform(get("/api/v2/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(3))
                .andExpect(jsonPath("$.hits").value(10))
                .andExpect(jsonPath("$.misses").value(4));
    }

    @Test
    void clear() throws Exception {
        mvc.perform(delete("/api/v2/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        verify(responseCache).clear();
        verify(providerResponseCaches).clear();
    }

    @Test
    void evictKnownAndUnknownFingerprint() throws Exception {
        when(responseCache.evict("abc")).thenReturn(true);
        when(responseCache.evict("missing")).thenReturn(false);

        mvc.perform(delete("/api/v2/cache/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("evicted"));
        mvc.perform(delete("/api/v2/cache/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("not_found"));
        verifyNoInteractions(providerResponseCaches);
    }
}
