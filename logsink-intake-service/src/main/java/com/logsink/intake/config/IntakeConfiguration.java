package com.logsink.intake.config;

import com.logsink.core.ingest.RecordNormalizer;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IntakeProperties.class)
public class IntakeConfiguration {

    @Bean
    public RecordNormalizer recordNormalizer(IntakeProperties props) {
        return new RecordNormalizer(props.getMaxTextLength());
    }

    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }
}
