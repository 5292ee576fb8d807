package com.logsink.channel.rabbitmq.consume;

import com.logsink.channel.rabbitmq.RabbitMqChannelProperties;
import com.logsink.channel.rabbitmq.RabbitMqTopology;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableRabbit
@EnableConfigurationProperties(RabbitMqChannelProperties.class)
@ConditionalOnProperty(prefix = "logsink.channel.rabbitmq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RabbitMqListenerConfiguration {

    @Bean
    public Declarables logsinkTopology(RabbitMqChannelProperties props) {
        return RabbitMqTopology.declarables(props);
    }
}
