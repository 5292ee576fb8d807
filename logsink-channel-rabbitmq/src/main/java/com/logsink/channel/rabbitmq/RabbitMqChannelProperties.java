package com.logsink.channel.rabbitmq;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and topology settings shared by the publishing intake and the consuming worker. Both
 * sides must agree on every queue argument, so they bind the same prefix.
 */
@Validated
@ConfigurationProperties(prefix = "logsink.channel.rabbitmq")
public class RabbitMqChannelProperties {

    private boolean enabled = true;

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 5672;

    @NotBlank
    private String username = "guest";

    private String password = "guest";

    @NotBlank
    private String virtualHost = "/";

    @NotBlank
    private String exchange = "logsink.records";

    @NotBlank
    private String routingKey = "logsink.records";

    @NotBlank
    private String queue = "logsink.records";

    @NotBlank
    private String retryExchange = "logsink.records.retry";

    @NotBlank
    private String retryQueue = "logsink.records.retry";

    /** How long a negatively acknowledged record waits before it is delivered again. */
    @NotNull
    private Duration ackDeadline = Duration.ofSeconds(60);

    /** Records published longer ago than this are dropped instead of processed. */
    @NotNull
    private Duration retention = Duration.ofDays(7);

    @NotNull
    private Duration confirmTimeout = Duration.ofSeconds(10);

    /**
     * How long the broker lets a delivery stay unacknowledged before it closes the consumer's
     * channel and requeues the delivery. Unset leaves the broker's own {@code consumer_timeout}
     * (30 minutes by default) in charge. Needs RabbitMQ 3.12 or later; changing it on an existing
     * queue makes the redeclare fail, so the queue has to be deleted first.
     */
    private Duration consumerTimeout;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public void setRoutingKey(String routingKey) {
        this.routingKey = routingKey;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getRetryExchange() {
        return retryExchange;
    }

    public void setRetryExchange(String retryExchange) {
        this.retryExchange = retryExchange;
    }

    public String getRetryQueue() {
        return retryQueue;
    }

    public void setRetryQueue(String retryQueue) {
        this.retryQueue = retryQueue;
    }

    public Duration getAckDeadline() {
        return ackDeadline;
    }

    public void setAckDeadline(Duration ackDeadline) {
        this.ackDeadline = ackDeadline;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public Duration getConfirmTimeout() {
        return confirmTimeout;
    }

    public void setConfirmTimeout(Duration confirmTimeout) {
        this.confirmTimeout = confirmTimeout;
    }

    public Duration getConsumerTimeout() {
        return consumerTimeout;
    }

    public void setConsumerTimeout(Duration consumerTimeout) {
        this.consumerTimeout = consumerTimeout;
    }
}
