package com.logsink.worker.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "logsink.worker")
public class WorkerProperties {

    /** Simulated processing cost per character of text. */
    @NotNull
    private Duration delayPerCharacter = Duration.ofMillis(50);

    public Duration getDelayPerCharacter() {
        return delayPerCharacter;
    }

    public void setDelayPerCharacter(Duration delayPerCharacter) {
        this.delayPerCharacter = delayPerCharacter;
    }
}
