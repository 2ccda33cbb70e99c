package com.cred.freestyle.eventpricing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the event ticket pricing service.
 *
 * System Overview:
 * - Prices finite-inventory event tickets from time-to-event, demand velocity and remaining stock
 * - Serializes bookings and cancellations per event so capacity is never oversold
 * - Short-lived Redis price cache, invalidated on every committed inventory change
 * - Per-customer sliding-window rate limiting on bookings
 * - Booking lifecycle messages on Kafka
 * - CloudWatch metrics for observability
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: booking/cancellation coordinators, pricing, queries
 * - Data Access Layer: JPA repositories with pessimistic locking
 * - Infrastructure Layer: Redis cache, pool locks, Kafka messaging, CloudWatch metrics
 *
 * @author Event Pricing Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class EventPricingApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventPricingApplication.class, args);
    }
}
