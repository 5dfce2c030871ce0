package com.habitsnap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ topology for inbound snap events.
 *
 * The surrounding application publishes one message per "snap sent to friend"
 * and per "snap approved" onto the snap events exchange. This service consumes
 * them from a durable queue. Messages that still fail after the listener's
 * local retries are rejected without requeue and dead-lettered to the DLQ,
 * where they stay for inspection instead of being dropped.
 *
 * Topology:
 * <pre>
 * snap.events.exchange --(snap.event)--------> snap.events.queue
 * snap.events.exchange --(snap.event.dlq)----> snap.events.dlq
 * </pre>
 *
 * @see com.habitsnap.messaging.SnapEventConsumer
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange.snap-events:snap.events.exchange}")
    private String snapEventsExchange;

    @Value("${app.rabbitmq.queue.snap-events:snap.events.queue}")
    private String snapEventsQueue;

    @Value("${app.rabbitmq.queue.snap-events-dlq:snap.events.dlq}")
    private String snapEventsDLQ;

    @Value("${app.rabbitmq.routing-key.snap-events:snap.event}")
    private String snapEventsRoutingKey;

    @Value("${app.rabbitmq.routing-key.dlq:snap.event.dlq}")
    private String dlqRoutingKey;

    /**
     * JSON message converter backed by the application ObjectMapper, so that
     * {@code java.time} fields in event payloads are read as ISO-8601.
     *
     * @param objectMapper the Spring-managed ObjectMapper
     * @return JSON message converter for listeners and templates
     */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        log.debug("Configuring Jackson2JsonMessageConverter for RabbitMQ");
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public DirectExchange snapEventsExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", snapEventsExchange);
        return new DirectExchange(snapEventsExchange, true, false);
    }

    /**
     * Main queue. Rejected messages are routed to the DLQ through the exchange.
     */
    @Bean
    public Queue snapEventsQueue() {
        log.info("Configuring queue: {} (durable=true, dlq={})", snapEventsQueue, snapEventsDLQ);
        return QueueBuilder.durable(snapEventsQueue)
                .withArgument("x-dead-letter-exchange", snapEventsExchange)
                .withArgument("x-dead-letter-routing-key", dlqRoutingKey)
                .build();
    }

    @Bean
    public Queue snapEventsDLQ() {
        log.info("Configuring DLQ: {} (durable=true)", snapEventsDLQ);
        return QueueBuilder.durable(snapEventsDLQ).build();
    }

    @Bean
    public Binding snapEventsBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}",
                snapEventsQueue, snapEventsExchange, snapEventsRoutingKey);

        return BindingBuilder
                .bind(snapEventsQueue())
                .to(snapEventsExchange())
                .with(snapEventsRoutingKey);
    }

    @Bean
    public Binding dlqBinding() {
        log.debug("Binding DLQ {} to exchange {} with routing key {}",
                snapEventsDLQ, snapEventsExchange, dlqRoutingKey);

        return BindingBuilder
                .bind(snapEventsDLQ())
                .to(snapEventsExchange())
                .with(dlqRoutingKey);
    }
}
