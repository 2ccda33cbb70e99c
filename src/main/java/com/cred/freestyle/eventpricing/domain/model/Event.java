package com.cred.freestyle.eventpricing.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event entity: a finite pool of tickets with its pricing configuration.
 * This is the source of truth for capacity, booked tickets and the last persisted price.
 *
 * bookedTickets is only changed under the event's pool lock
 * (see {@link com.cred.freestyle.eventpricing.service.InventoryLedger}).
 *
 * @author Event Pricing Team
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_active_date", columnList = "is_active, event_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    @Id
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "venue", nullable = false, length = 255)
    private String venue;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Scheduled start of the event. No bookings or cancellations after this instant.
     */
    @Column(name = "event_date", nullable = false)
    private Instant eventDate;

    /**
     * Total tickets. Set at creation and never changed.
     */
    @Column(name = "capacity", nullable = false, updatable = false)
    private Integer capacity;

    @Column(name = "booked_tickets", nullable = false)
    private Integer bookedTickets;

    @Column(name = "base_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal basePrice;

    /**
     * Last price charged or recomputed. Informational; live prices come from the price model.
     */
    @Column(name = "current_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal currentPrice;

    @Column(name = "floor_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal floorPrice;

    @Column(name = "ceiling_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal ceilingPrice;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Embedded
    private PricingRuleSet pricingRules;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (bookedTickets == null) bookedTickets = 0;
        if (currentPrice == null) currentPrice = basePrice;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @JsonIgnore
    public int getAvailableTickets() {
        return capacity - bookedTickets;
    }

    @JsonIgnore
    public boolean isSoldOut() {
        return bookedTickets >= capacity;
    }

    /**
     * An event accepts bookings while it is active and has not started yet.
     *
     * @param now Current time
     * @return true if bookings are accepted at {@code now}
     */
    public boolean isOpenForBooking(Instant now) {
        return Boolean.TRUE.equals(isActive) && !now.isAfter(eventDate);
    }

    public boolean hasStarted(Instant now) {
        return now.isAfter(eventDate);
    }
}
