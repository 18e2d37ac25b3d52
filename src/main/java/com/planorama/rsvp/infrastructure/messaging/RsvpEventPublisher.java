package com.planorama.rsvp.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planorama.rsvp.infrastructure.messaging.events.RsvpDomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for RSVP and invitation domain events.
 *
 * Topic partitioning strategy:
 * - Key: event ID, so every change to one event lands on the same partition in order
 *
 * When called inside a transaction the send is deferred until after commit, so consumers never
 * see a response that was rolled back. Publish failures are logged and never reach the caller.
 *
 * @author Planorama Team
 */
@Service
public class RsvpEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(RsvpEventPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public RsvpEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${rsvp.events.topic:planorama-rsvp-events}") String topic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    /**
     * Publish a domain event, after commit if a transaction is active.
     *
     * @param event Domain event
     */
    public void publish(RsvpDomainEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event);
                }
            });
        } else {
            send(event);
        }
    }

    private void send(RsvpDomainEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    topic,
                    event.getEventId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} for event {}, partition: {}",
                            event.getEventType(), event.getEventId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} for event {}",
                            event.getEventType(), event.getEventId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} for event {}", event.getEventType(), event.getEventId(), e);
        } catch (RuntimeException e) {
            // Broker metadata timeouts surface synchronously from send()
            logger.error("Error publishing {} for event {}", event.getEventType(), event.getEventId(), e);
        }
    }
}
