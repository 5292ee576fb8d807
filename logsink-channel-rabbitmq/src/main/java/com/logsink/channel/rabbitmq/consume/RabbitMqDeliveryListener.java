package com.logsink.channel.rabbitmq.consume;

import com.logsink.channel.rabbitmq.RabbitMqChannelProperties;
import com.logsink.core.worker.DeliveryProcessor;
import com.logsink.core.worker.DeliveryResult;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Maps {@link DeliveryResult} onto manual AMQP acknowledgements. {@code ACK} and {@code DISCARD}
 * are acked; {@code RETRY} is nacked without requeue so the broker parks the message in the retry
 * queue for one ack deadline.
 */
@Component
@ConditionalOnProperty(prefix = "logsink.channel.rabbitmq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RabbitMqDeliveryListener {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqDeliveryListener.class);
    static final String SOURCE = "RMQ_CONSUMER";

    private final DeliveryProcessor processor;
    private final RabbitMqChannelProperties props;
    private final Clock clock;

    public RabbitMqDeliveryListener(DeliveryProcessor processor, RabbitMqChannelProperties props, Clock clock) {
        this.processor = processor;
        this.props = props;
        this.clock = clock;
    }

    @RabbitListener(queues = "${logsink.channel.rabbitmq.queue:logsink.records}", ackMode = "MANUAL")
    public void handle(Message message, Channel channel) throws IOException {
        MessageProperties properties = message.getMessageProperties();
        long tag = properties.getDeliveryTag();
        String messageId = properties.getMessageId() != null ? properties.getMessageId() : "delivery-" + tag;

        if (expired(properties)) {
            log.warn(
                    "Dropping message {} published at {}: older than retention {}",
                    messageId,
                    properties.getTimestamp().toInstant(),
                    props.getRetention());
            channel.basicAck(tag, false);
            return;
        }

        DeliveryResult result;
        try {
            result = processor.process(messageId, message.getBody(), SOURCE);
        } catch (RuntimeException ex) {
            log.error("Unhandled failure processing message {}; leaving it for redelivery", messageId, ex);
            channel.basicNack(tag, false, false);
            return;
        }

        switch (result.outcome()) {
            case ACK, DISCARD -> channel.basicAck(tag, false);
            case RETRY -> {
                log.warn(
                        "Message {} for tenant={} log_id={} will be redelivered after {} ({})",
                        messageId,
                        result.tenantId(),
                        result.logId(),
                        props.getAckDeadline(),
                        result.reason());
                channel.basicNack(tag, false, false);
            }
        }
    }

    private boolean expired(MessageProperties properties) {
        if (properties.getTimestamp() == null) {
            return false;
        }
        Instant published = properties.getTimestamp().toInstant();
        return Duration.between(published, clock.instant()).compareTo(props.getRetention()) > 0;
    }
}
