package io.relay4j.internal.amqp;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import io.relay4j.BrokerGateway;
import io.relay4j.ResultHandler;
import io.relay4j.core.DispatchEnvelope;
import io.relay4j.core.PublishException;
import io.relay4j.core.ResultEvent;
import io.relay4j.core.StoreException;
import io.relay4j.internal.SchedulerCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionListener;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.util.backoff.ExponentialBackOff;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link BrokerGateway} on RabbitMQ through Spring AMQP.
 *
 * <p>Connectivity is tracked with a {@link ConnectionListener}; while the connection is down,
 * {@link #publish(DispatchEnvelope)} fails immediately instead of blocking the caller, and the
 * listener container reconnects on its own with exponential backoff. Unacknowledged results are
 * redelivered by the broker.
 */
public class RabbitBrokerGateway implements BrokerGateway {
    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerGateway.class);

    private final ConnectionFactory connectionFactory;
    private final RabbitTemplate rabbitTemplate;
    private final AmqpAdmin amqpAdmin;
    private final RelayMessageCodec codec;
    private final BrokerSettings settings;

    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean topologyPending = new AtomicBoolean(false);
    private final AtomicInteger storeFailures = new AtomicInteger();
    private final Object containerLock = new Object();
    private SimpleMessageListenerContainer container;

    public RabbitBrokerGateway(ConnectionFactory connectionFactory,
                               RabbitTemplate rabbitTemplate,
                               AmqpAdmin amqpAdmin,
                               RelayMessageCodec codec,
                               BrokerSettings settings) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");
        this.rabbitTemplate = Objects.requireNonNull(rabbitTemplate, "rabbitTemplate must not be null");
        this.amqpAdmin = Objects.requireNonNull(amqpAdmin, "amqpAdmin must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");

        this.connectionFactory.addConnectionListener(new ConnectionListener() {
            @Override
            public void onCreate(Connection connection) {
                if (!connected.getAndSet(true)) {
                    log.info("relay broker connected host={}:{}", connectionFactory.getHost(), connectionFactory.getPort());
                }
                if (topologyPending.compareAndSet(true, false)) {
                    declarePendingTopology();
                }
            }

            @Override
            public void onClose(Connection connection) {
                if (connected.getAndSet(false)) {
                    log.warn("relay broker connection closed");
                }
            }

            @Override
            public void onShutDown(ShutdownSignalException signal) {
                if (connected.getAndSet(false)) {
                    log.warn("relay broker connection lost msg={}", signal.getMessage());
                }
            }

            @Override
            public void onFailed(Exception exception) {
                connected.set(false);
                log.warn("relay broker connection attempt failed msg={}", exception.getMessage());
            }
        });
    }

    /**
     * Declare the exchange, the result queue with its dead-letter route, and the result bindings.
     * Opens the connection as a side effect.
     */
    public void declareTopology() {
        TopicExchange exchange = new TopicExchange(settings.exchange(), true, false);
        DirectExchange deadLetterExchange = new DirectExchange(settings.deadLetterExchange(), true, false);
        Queue deadLetterQueue = QueueBuilder.durable(settings.deadLetterQueue()).build();
        Queue resultQueue = QueueBuilder.durable(settings.resultQueue())
                .deadLetterExchange(settings.deadLetterExchange())
                .deadLetterRoutingKey(settings.deadLetterQueue())
                .build();

        amqpAdmin.declareExchange(exchange);
        amqpAdmin.declareExchange(deadLetterExchange);
        amqpAdmin.declareQueue(deadLetterQueue);
        amqpAdmin.declareQueue(resultQueue);
        amqpAdmin.declareBinding(BindingBuilder.bind(deadLetterQueue).to(deadLetterExchange).with(settings.deadLetterQueue()));
        for (String key : settings.resultRoutingKeys()) {
            amqpAdmin.declareBinding(BindingBuilder.bind(resultQueue).to(exchange).with(key));
            log.info("relay bound queue={} routingKey={}", settings.resultQueue(), key);
        }
    }

    @Override
    public void publish(DispatchEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        if (!connected.get()) {
            throw new PublishException(envelope.jobId(), "broker is not connected");
        }

        String routingKey = settings.dispatchRoutingKey(envelope.jobType());
        Message message = MessageBuilder.withBody(codec.encodeDispatch(envelope))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(envelope.jobId() + ":" + envelope.attemptCount())
                .setType(RelayMessageCodec.EXECUTE_EVENT)
                .build();

        try {
            if (confirmsEnabled()) {
                long timeoutMs = settings.confirmTimeout().toMillis();
                rabbitTemplate.invoke(ops -> {
                    ops.send(settings.exchange(), routingKey, message);
                    ops.waitForConfirmsOrDie(timeoutMs);
                    return Boolean.TRUE;
                });
            } else {
                rabbitTemplate.send(settings.exchange(), routingKey, message);
            }
        } catch (AmqpException e) {
            throw new PublishException(envelope.jobId(),
                    "publish to " + settings.exchange() + "/" + routingKey + " failed: " + e.getMessage(), e);
        }
        log.debug("relay published id={} routingKey={} attempt={}", envelope.jobId(), routingKey, envelope.attemptCount());
    }

    @Override
    public void consume(ResultHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");

        synchronized (containerLock) {
            if (container != null) {
                throw new IllegalStateException("result consumer already running");
            }

            try {
                declareTopology();
            } catch (AmqpException e) {
                // retried from the connection listener once the broker is reachable
                topologyPending.set(true);
                log.warn("relay topology declaration failed, will retry on connect msg={}", e.getMessage());
            }

            ExponentialBackOff backOff = new ExponentialBackOff(settings.recoveryInitialInterval().toMillis(), 2.0);
            backOff.setMaxInterval(settings.recoveryMaxInterval().toMillis());

            SimpleMessageListenerContainer c = new SimpleMessageListenerContainer(connectionFactory);
            c.setQueueNames(settings.resultQueue());
            c.setAcknowledgeMode(AcknowledgeMode.MANUAL);
            c.setPrefetchCount(settings.prefetch());
            c.setDefaultRequeueRejected(false);
            c.setMissingQueuesFatal(false);
            c.setRecoveryBackOff(backOff);
            c.setMessageListener((ChannelAwareMessageListener) (message, channel) -> onMessage(message, channel, handler));
            c.afterPropertiesSet();
            c.start();
            container = c;
        }
        log.info("relay consuming queue={} prefetch={}", settings.resultQueue(), settings.prefetch());
    }

    void onMessage(Message message, Channel channel, ResultHandler handler) throws IOException {
        long tag = message.getMessageProperties().getDeliveryTag();

        ResultEvent event;
        try {
            event = codec.decodeResult(message.getBody());
        } catch (MessageDecodeException e) {
            log.warn("relay undecodable result dead-lettered tag={} msg={}", tag, e.getMessage());
            channel.basicReject(tag, false);
            return;
        }

        try {
            handler.onResult(event);
            storeFailures.set(0);
            channel.basicAck(tag, false);
        } catch (StoreException e) {
            // hold the delivery so a store outage does not turn into a redelivery loop
            int failures = storeFailures.incrementAndGet();
            Duration delay = SchedulerCore.backoff(failures);
            log.warn("relay result left for redelivery id={} failures={} delay={} msg={}",
                    event.jobId(), failures, delay, e.getMessage());
            pauseBeforeRedelivery(delay);
            channel.basicNack(tag, false, true);
        } catch (Exception e) {
            log.error("relay result handler failed id={} kind={} msg={}",
                    event.jobId(), e.getClass().getSimpleName(), e.getMessage(), e);
            channel.basicNack(tag, false, false);
        }
    }

    void pauseBeforeRedelivery(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void declarePendingTopology() {
        try {
            declareTopology();
            log.info("relay topology declared after reconnect exchange={}", settings.exchange());
        } catch (AmqpException e) {
            topologyPending.set(true);
            log.warn("relay topology declaration failed msg={}", e.getMessage());
        }
    }

    private boolean confirmsEnabled() {
        return connectionFactory.isSimplePublisherConfirms() && !settings.confirmTimeout().isZero();
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public void stop() {
        SimpleMessageListenerContainer c;
        synchronized (containerLock) {
            c = container;
            container = null;
        }
        if (c != null) {
            c.stop();
            c.destroy();
            log.info("relay result consumer stopped queue={}", settings.resultQueue());
        }
    }
}
