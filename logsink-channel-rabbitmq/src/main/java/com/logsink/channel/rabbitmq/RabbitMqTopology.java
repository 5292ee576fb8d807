package com.logsink.channel.rabbitmq;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;

/**
 * Queue layout of the delivery channel.
 *
 * <pre>
 *   exchange  --routing key-->  queue  --nack (dead-letter)-->  retry exchange  -->  retry queue
 *      ^                                                                              |
 *      +------------------------- message TTL = ack deadline -------------------------+
 * </pre>
 *
 * A negatively acknowledged record sits in the retry queue for one ack deadline and is then routed
 * back to the main queue. The ack deadline does not bound a delivery that is never acknowledged at
 * all: a hung worker keeps it until the consumer timeout fires, which is the broker's
 * {@code consumer_timeout} unless {@code consumer-timeout} is set. Declarations are idempotent as long as every declarer uses the argument
 * maps built here.
 */
public final class RabbitMqTopology {

    static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    static final String MESSAGE_TTL = "x-message-ttl";
    static final String CONSUMER_TIMEOUT = "x-consumer-timeout";

    private RabbitMqTopology() {}

    public static Map<String, Object> mainQueueArguments(RabbitMqChannelProperties props) {
        if (props.getConsumerTimeout() == null) {
            return Map.of(
                    DEAD_LETTER_EXCHANGE, props.getRetryExchange(),
                    DEAD_LETTER_ROUTING_KEY, props.getRoutingKey());
        }
        return Map.of(
                DEAD_LETTER_EXCHANGE, props.getRetryExchange(),
                DEAD_LETTER_ROUTING_KEY, props.getRoutingKey(),
                CONSUMER_TIMEOUT, props.getConsumerTimeout().toMillis());
    }

    public static Map<String, Object> retryQueueArguments(RabbitMqChannelProperties props) {
        return Map.of(
                DEAD_LETTER_EXCHANGE, props.getExchange(),
                DEAD_LETTER_ROUTING_KEY, props.getRoutingKey(),
                MESSAGE_TTL, props.getAckDeadline().toMillis());
    }

    /** Declares the layout on a raw client channel. */
    public static void declare(Channel channel, RabbitMqChannelProperties props) throws IOException {
        channel.exchangeDeclare(props.getExchange(), BuiltinExchangeType.DIRECT, true);
        channel.exchangeDeclare(props.getRetryExchange(), BuiltinExchangeType.DIRECT, true);
        channel.queueDeclare(props.getQueue(), true, false, false, mainQueueArguments(props));
        channel.queueDeclare(props.getRetryQueue(), true, false, false, retryQueueArguments(props));
        channel.queueBind(props.getQueue(), props.getExchange(), props.getRoutingKey());
        channel.queueBind(props.getRetryQueue(), props.getRetryExchange(), props.getRoutingKey());
    }

    /** Same layout for Spring AMQP's admin, declared whenever the listener container connects. */
    public static Declarables declarables(RabbitMqChannelProperties props) {
        DirectExchange exchange = new DirectExchange(props.getExchange(), true, false);
        DirectExchange retryExchange = new DirectExchange(props.getRetryExchange(), true, false);
        Queue queue = new Queue(props.getQueue(), true, false, false, new HashMap<>(mainQueueArguments(props)));
        Queue retryQueue = new Queue(
                props.getRetryQueue(), true, false, false, new HashMap<>(retryQueueArguments(props)));
        Binding binding = BindingBuilder.bind(queue).to(exchange).with(props.getRoutingKey());
        Binding retryBinding = BindingBuilder.bind(retryQueue).to(retryExchange).with(props.getRoutingKey());
        return new Declarables(exchange, retryExchange, queue, retryQueue, binding, retryBinding);
    }
}
