package com.logsink.channel.rabbitmq.publish;

import com.logsink.channel.rabbitmq.RabbitMqChannelProperties;
import com.logsink.core.channel.CanonicalRecordCodec;
import com.logsink.core.channel.DeliveryChannel;
import com.rabbitmq.client.ConnectionFactory;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RabbitMqChannelProperties.class)
@ConditionalOnProperty(prefix = "logsink.channel.rabbitmq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RabbitMqPublisherConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CanonicalRecordCodec canonicalRecordCodec() {
        return new CanonicalRecordCodec();
    }

    @Bean
    public ConnectionFactory logsinkPublisherConnectionFactory(RabbitMqChannelProperties props) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(props.getHost());
        factory.setPort(props.getPort());
        factory.setUsername(props.getUsername());
        factory.setPassword(props.getPassword());
        factory.setVirtualHost(props.getVirtualHost());
        factory.setConnectionTimeout((int) Duration.ofSeconds(10).toMillis());
        factory.setAutomaticRecoveryEnabled(true);
        return factory;
    }

    @Bean
    public DeliveryChannel deliveryChannel(
            ConnectionFactory logsinkPublisherConnectionFactory,
            CanonicalRecordCodec codec,
            RabbitMqChannelProperties props,
            Clock clock) {
        return new RabbitMqDeliveryChannel(logsinkPublisherConnectionFactory, codec, props, clock);
    }
}
