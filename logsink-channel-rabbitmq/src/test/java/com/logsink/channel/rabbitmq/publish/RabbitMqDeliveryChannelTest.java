package com.logsink.channel.rabbitmq.publish;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsink.channel.rabbitmq.RabbitMqChannelProperties;
import com.logsink.core.channel.CanonicalRecordCodec;
import com.logsink.core.channel.ChannelPublishException;
import com.logsink.core.model.CanonicalRecord;
import com.logsink.core.model.RecordSource;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class RabbitMqDeliveryChannelTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final ConnectionFactory factory = Mockito.mock(ConnectionFactory.class);
    private final Connection connection = Mockito.mock(Connection.class);
    private final Channel channel = Mockito.mock(Channel.class);
    private final RabbitMqChannelProperties props = new RabbitMqChannelProperties();

    private RabbitMqDeliveryChannel deliveryChannel;

    @BeforeEach
    void setUp() throws Exception {
        Mockito.when(factory.newConnection(Mockito.anyString())).thenReturn(connection);
        Mockito.when(connection.isOpen()).thenReturn(true);
        Mockito.when(connection.createChannel()).thenReturn(channel);
        Mockito.when(channel.isOpen()).thenReturn(true);
        deliveryChannel = new RabbitMqDeliveryChannel(
                factory, new CanonicalRecordCodec(), props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void publishesPersistentMessageAndWaitsForConfirm() throws Exception {
        String messageId = deliveryChannel.publish(record());

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        Mockito.verify(channel).confirmSelect();
        Mockito.verify(channel)
                .basicPublish(
                        Mockito.eq("logsink.records"),
                        Mockito.eq("logsink.records"),
                        properties.capture(),
                        body.capture());
        Mockito.verify(channel).waitForConfirmsOrDie(10_000L);

        AMQP.BasicProperties sent = properties.getValue();
        assertThat(sent.getMessageId()).isEqualTo(messageId);
        assertThat(sent.getDeliveryMode()).isEqualTo(2);
        assertThat(sent.getTimestamp()).isEqualTo(Date.from(NOW));
        assertThat(sent.getHeaders()).containsEntry("tenant_id", "acme").containsEntry("log_id", "t1");

        JsonNode json = new ObjectMapper().readTree(body.getValue());
        assertThat(json.get("tenant_id").asText()).isEqualTo("acme");
        assertThat(json.get("text").asText()).isEqualTo("Call 555-0199 now");
    }

    @Test
    void declaresTopologyOnNewChannel() throws Exception {
        deliveryChannel.publish(record());
        deliveryChannel.publish(record());

        Mockito.verify(connection, Mockito.times(1)).createChannel();
        Mockito.verify(channel).exchangeDeclare("logsink.records", BuiltinExchangeType.DIRECT, true);
        Mockito.verify(channel)
                .queueDeclare(
                        "logsink.records",
                        true,
                        false,
                        false,
                        Map.of(
                                "x-dead-letter-exchange", "logsink.records.retry",
                                "x-dead-letter-routing-key", "logsink.records"));
        Mockito.verify(channel)
                .queueDeclare(
                        "logsink.records.retry",
                        true,
                        false,
                        false,
                        Map.of(
                                "x-dead-letter-exchange", "logsink.records",
                                "x-dead-letter-routing-key", "logsink.records",
                                "x-message-ttl", 60_000L));
    }

    @Test
    void missingConfirmFailsThePublishAndRecyclesTheChannel() throws Exception {
        Mockito.doThrow(new IOException("nack received"))
                .doNothing()
                .when(channel)
                .waitForConfirmsOrDie(Mockito.anyLong());

        assertThatThrownBy(() -> deliveryChannel.publish(record()))
                .isInstanceOf(ChannelPublishException.class)
                .hasCauseInstanceOf(IOException.class);
        Mockito.verify(channel).close();

        deliveryChannel.publish(record());
        Mockito.verify(connection, Mockito.times(2)).createChannel();
    }

    @Test
    void brokerUnreachableIsReportedAsPublishFailure() throws Exception {
        Mockito.when(factory.newConnection(Mockito.anyString())).thenThrow(new IOException("connection refused"));

        assertThatThrownBy(() -> deliveryChannel.publish(record())).isInstanceOf(ChannelPublishException.class);
    }

    @Test
    void closeReleasesChannelAndConnection() throws Exception {
        deliveryChannel.publish(record());

        deliveryChannel.close();

        Mockito.verify(channel).close();
        Mockito.verify(connection).close();
    }

    @Test
    void slowConfirmDoesNotHoldUpOtherPublishers() throws Exception {
        Channel slowChannel = Mockito.mock(Channel.class);
        Channel fastChannel = Mockito.mock(Channel.class);
        Mockito.when(slowChannel.isOpen()).thenReturn(true);
        Mockito.when(fastChannel.isOpen()).thenReturn(true);
        Mockito.when(connection.createChannel()).thenReturn(slowChannel, fastChannel);
        CountDownLatch confirming = new CountDownLatch(1);
        CountDownLatch confirmArrives = new CountDownLatch(1);
        Mockito.doAnswer(invocation -> {
                    confirming.countDown();
                    confirmArrives.await(5, TimeUnit.SECONDS);
                    return null;
                })
                .when(slowChannel)
                .waitForConfirmsOrDie(Mockito.anyLong());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> slow = executor.submit(() -> deliveryChannel.publish(record()));
            assertThat(confirming.await(5, TimeUnit.SECONDS)).isTrue();

            String fast = deliveryChannel.publish(record());

            assertThat(slow.isDone()).isFalse();
            Mockito.verify(fastChannel).waitForConfirmsOrDie(10_000L);
            confirmArrives.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS)).isNotEqualTo(fast);
        } finally {
            confirmArrives.countDown();
            executor.shutdownNow();
        }
        Mockito.verify(connection, Mockito.times(2)).createChannel();
        Mockito.verify(factory, Mockito.times(1)).newConnection(Mockito.anyString());
    }

    @Test
    void closeReleasesEveryThreadsChannelEvenWhenOneFails() throws Exception {
        Channel other = Mockito.mock(Channel.class);
        Mockito.when(other.isOpen()).thenReturn(true);
        Mockito.when(connection.createChannel()).thenReturn(channel, other);
        Mockito.doThrow(new IOException("already closing")).when(channel).close();

        deliveryChannel.publish(record());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> deliveryChannel.publish(record())).get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThatThrownBy(() -> deliveryChannel.close())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("channel");
        Mockito.verify(channel).close();
        Mockito.verify(other).close();
        Mockito.verify(connection).close();
    }

    private static CanonicalRecord record() {
        return new CanonicalRecord("acme", "t1", "Call 555-0199 now", RecordSource.STRUCTURED_UPLOAD, NOW);
    }
}
