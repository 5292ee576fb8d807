package com.logsink.worker.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.logsink.core.model.ProcessedDocument;
import com.logsink.core.model.RecordSource;
import com.logsink.core.store.InMemoryTenantStore;
import java.time.Clock;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class TenantDocumentControllerTest {

    private final InMemoryTenantStore store = new InMemoryTenantStore();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        Instant at = Instant.parse("2025-03-01T10:00:00Z");
        store.put("acme", "t1", new ProcessedDocument(
                RecordSource.STRUCTURED_UPLOAD, "Call 555-0199 now", "Call [REDACTED] now", at, at, 0.85, 17));
        store.put("beta", "t1", new ProcessedDocument(RecordSource.TEXT_UPLOAD, "beta", "beta", at, at, 0.2, 4));
        mvc = MockMvcBuilders.standaloneSetup(new TenantDocumentController(store))
                .setControllerAdvice(new TenantDocumentExceptionHandler(Clock.systemUTC()))
                .build();
    }

    @Test
    void returnsDocumentOfTheRequestedTenantOnly() throws Exception {
        mvc.perform(get("/tenants/acme/processed_logs/t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.original_text").value("Call 555-0199 now"))
                .andExpect(jsonPath("$.modified_data").value("Call [REDACTED] now"))
                .andExpect(jsonPath("$.char_count").value(17));
        mvc.perform(get("/tenants/beta/processed_logs/t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.original_text").value("beta"));
    }

    @Test
    void listsTenantCollection() throws Exception {
        mvc.perform(get("/tenants/acme/processed_logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenant_id").value("acme"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.documents.t1.source").value("structured_upload"));
    }

    @Test
    void missingDocumentIsNotFound() throws Exception {
        mvc.perform(get("/tenants/acme/processed_logs/unknown")).andExpect(status().isNotFound());
        mvc.perform(get("/tenants/nobody/processed_logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void invalidTenantIsRejected() throws Exception {
        mvc.perform(get("/tenants/bad@tenant/processed_logs")).andExpect(status().isBadRequest());
    }
}
