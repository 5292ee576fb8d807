package com.logsink.intake.rest;

import com.logsink.core.channel.DeliveryChannel;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final DeliveryChannel channel;

    public HealthController(DeliveryChannel channel) {
        this.channel = channel;
    }

    @GetMapping({"/", "/health"})
    public Map<String, Object> health() {
        return Map.of("service", "logsink-intake", "status", "healthy", "channel", channel.describe());
    }
}
