package com.cred.freestyle.eventpricing.infrastructure.messaging;

import com.cred.freestyle.eventpricing.infrastructure.messaging.events.BookingLifecycleEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for booking lifecycle messages.
 *
 * Messages are keyed by event ID so all changes of one event land on the same
 * partition in commit order. Publishing is fire-and-forget: it runs after the
 * booking transaction has committed and a failure is only logged.
 *
 * @author Event Pricing Team
 */
@Service
public class BookingEventProducer {

    private static final Logger logger = LoggerFactory.getLogger(BookingEventProducer.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${eventpricing.messaging.booking-topic:event-pricing.bookings}")
    private String bookingTopic = "event-pricing.bookings";

    public BookingEventProducer(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish a booking lifecycle message.
     *
     * @param event Lifecycle message
     */
    public void publish(BookingLifecycleEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    bookingTopic,
                    event.getEventId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} for booking {}, event: {}, partition: {}",
                            event.getEventType(), event.getBookingId(), event.getEventId(),
                            result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} for booking {}, event: {}",
                            event.getEventType(), event.getBookingId(), event.getEventId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} for booking {}", event.getEventType(), event.getBookingId(), e);
        } catch (RuntimeException e) {
            logger.error("Error sending {} for booking {} to topic {}",
                    event.getEventType(), event.getBookingId(), bookingTopic, e);
        }
    }
}
