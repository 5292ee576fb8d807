package com.logsink.worker.config;

import com.logsink.core.channel.CanonicalRecordCodec;
import com.logsink.core.deadletter.DiscardedDeliveryTable;
import com.logsink.core.deadletter.InMemoryDiscardedDeliveryTable;
import com.logsink.core.delay.LengthProportionalDelay;
import com.logsink.core.delay.ProcessingDelay;
import com.logsink.core.redact.PhoneNumberRedactor;
import com.logsink.core.store.InMemoryTenantStore;
import com.logsink.core.store.TenantStore;
import com.logsink.core.worker.DeliveryProcessor;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(WorkerProperties.class)
public class WorkerConfiguration {

    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CanonicalRecordCodec canonicalRecordCodec() {
        return new CanonicalRecordCodec();
    }

    @Bean
    public PhoneNumberRedactor phoneNumberRedactor() {
        return new PhoneNumberRedactor();
    }

    @Bean
    public ProcessingDelay processingDelay(WorkerProperties props) {
        return new LengthProportionalDelay(props.getDelayPerCharacter());
    }

    @Bean
    public DeliveryProcessor deliveryProcessor(
            CanonicalRecordCodec codec,
            ProcessingDelay delay,
            PhoneNumberRedactor redactor,
            TenantStore store,
            DiscardedDeliveryTable discards,
            Clock clock) {
        return new DeliveryProcessor(codec, delay, redactor, store, discards, clock);
    }

    /** Process-local storage for {@code logsink.store.type=memory}; see application-memory.yml. */
    @Configuration
    @ConditionalOnProperty(prefix = "logsink.store", name = "type", havingValue = "memory")
    static class InMemoryStorage {

        @Bean
        public TenantStore inMemoryTenantStore() {
            return new InMemoryTenantStore();
        }

        @Bean
        public DiscardedDeliveryTable inMemoryDiscardedDeliveryTable(Clock clock) {
            return new InMemoryDiscardedDeliveryTable(clock);
        }
    }
}
