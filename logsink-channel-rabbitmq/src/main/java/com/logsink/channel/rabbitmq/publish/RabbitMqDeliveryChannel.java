package com.logsink.channel.rabbitmq.publish;

import com.logsink.channel.rabbitmq.RabbitMqChannelProperties;
import com.logsink.channel.rabbitmq.RabbitMqTopology;
import com.logsink.core.channel.CanonicalRecordCodec;
import com.logsink.core.channel.ChannelPublishException;
import com.logsink.core.channel.DeliveryChannel;
import com.logsink.core.model.CanonicalRecord;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownNotifier;
import java.io.IOException;
import java.time.Clock;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeliveryChannel} that publishes canonical records to RabbitMQ with publisher confirms. A
 * record counts as enqueued only once the broker has confirmed it; until then the caller sees a
 * {@link ChannelPublishException}.
 *
 * <p>Publishing threads do not share a channel: each one opens its own confirm channel on the
 * shared connection, so a slow confirm only holds up the request that is waiting for it.
 */
public class RabbitMqDeliveryChannel implements DeliveryChannel {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqDeliveryChannel.class);

    static final String TENANT_HEADER = "tenant_id";
    static final String LOG_ID_HEADER = "log_id";
    private static final String CONNECTION_NAME = "logsink-intake";

    private final ConnectionFactory factory;
    private final CanonicalRecordCodec codec;
    private final RabbitMqChannelProperties props;
    private final Clock clock;

    // Confirms are tracked per channel, so each publishing thread gets its own.
    private final ThreadLocal<Channel> threadChannel = new ThreadLocal<>();
    private final Set<Channel> confirmChannels = ConcurrentHashMap.newKeySet();
    private final Object connectionLock = new Object();
    private Connection connection;

    public RabbitMqDeliveryChannel(
            ConnectionFactory factory, CanonicalRecordCodec codec, RabbitMqChannelProperties props, Clock clock) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String publish(CanonicalRecord record) {
        byte[] body = codec.encode(record);
        String messageId = UUID.randomUUID().toString();
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType("application/json")
                .contentEncoding("UTF-8")
                .deliveryMode(2)
                .messageId(messageId)
                .timestamp(Date.from(clock.instant()))
                .headers(Map.of(TENANT_HEADER, record.tenantId(), LOG_ID_HEADER, record.logId()))
                .build();
        try {
            Channel ch = obtainChannel();
            ch.basicPublish(props.getExchange(), props.getRoutingKey(), properties, body);
            ch.waitForConfirmsOrDie(props.getConfirmTimeout().toMillis());
        } catch (IOException | TimeoutException e) {
            resetChannel();
            throw new ChannelPublishException("Failed to publish " + record.documentPath() + " to RabbitMQ", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            resetChannel();
            throw new ChannelPublishException("Interrupted while waiting for RabbitMQ publisher confirm", e);
        }
        log.debug("Broker confirmed message {} for {}", messageId, record.documentPath());
        return messageId;
    }

    @Override
    public String describe() {
        return "rabbitmq:" + props.getExchange() + "/" + props.getRoutingKey();
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (Channel ch : confirmChannels) {
            failure = release(ch, "channel", failure);
        }
        confirmChannels.clear();

        Connection current;
        synchronized (connectionLock) {
            current = connection;
            connection = null;
        }
        failure = release(current, "connection", failure);

        if (failure != null) throw failure;
    }

    private Channel obtainChannel() throws IOException, TimeoutException {
        Channel ch = threadChannel.get();
        if (ch != null && ch.isOpen() && confirmChannels.contains(ch)) {
            return ch;
        }
        Channel created = connection().createChannel();
        RabbitMqTopology.declare(created, props);
        created.confirmSelect();
        threadChannel.set(created);
        confirmChannels.add(created);
        return created;
    }

    private Connection connection() throws IOException, TimeoutException {
        synchronized (connectionLock) {
            if (connection == null || !connection.isOpen()) {
                connection = factory.newConnection(CONNECTION_NAME);
            }
            return connection;
        }
    }

    // A channel that saw a failed publish or a nack may hold unconfirmed state; start over.
    private void resetChannel() {
        Channel stale = threadChannel.get();
        threadChannel.remove();
        if (stale == null) {
            return;
        }
        confirmChannels.remove(stale);
        IOException failure = release(stale, "channel", null);
        if (failure != null) {
            log.debug("Ignoring failure while closing stale RabbitMQ channel: {}", failure.getCause().getMessage());
        }
    }

    private static <R extends ShutdownNotifier & AutoCloseable> IOException release(
            R resource, String what, IOException failure) {
        if (resource == null || !resource.isOpen()) {
            return failure;
        }
        try {
            resource.close();
        } catch (Exception ex) {
            if (failure == null) {
                return new IOException("Failed to close RabbitMQ " + what, ex);
            }
            failure.addSuppressed(ex);
        }
        return failure;
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "RabbitMqDeliveryChannel[%s:%d -> %s/%s]",
                factory.getHost(),
                factory.getPort(),
                props.getExchange(),
                props.getRoutingKey());
    }
}
