package com.logsink.worker.rest;

import com.logsink.core.store.TenantStore;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final TenantStore store;

    @GetMapping({"/", "/health"})
    public Map<String, Object> health() {
        return Map.of("service", "logsink-worker", "status", "healthy", "store", store.getClass().getSimpleName());
    }
}
