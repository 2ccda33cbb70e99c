package com.cred.freestyle.eventpricing.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Booking entity: a committed claim on tickets of one event at a locked-in price.
 *
 * A booking exists exactly as long as its tickets are counted in the event's
 * bookedTickets. Both are written in the same transaction on creation and
 * removed together on cancellation.
 *
 * @author Event Pricing Team
 */
@Entity
@Table(name = "bookings", indexes = {
    @Index(name = "idx_bookings_event_created", columnList = "event_id, created_at"),
    @Index(name = "idx_bookings_customer", columnList = "customer_email")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {

    @Id
    @Column(name = "booking_id", nullable = false, length = 36)
    private String bookingId;

    /**
     * Back-reference to events.event_id. The event does not own its bookings.
     */
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "customer_email", nullable = false, length = 255)
    private String customerEmail;

    @Column(name = "ticket_count", nullable = false)
    private Integer ticketCount;

    @Column(name = "price_per_ticket", nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerTicket;

    /**
     * pricePerTicket x ticketCount, fixed at commit time.
     */
    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private BookingStatus status = BookingStatus.CONFIRMED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (bookingId == null) {
            bookingId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Booking status enum.
     * Cancelled bookings are deleted, so CANCELLED only appears on receipts and lifecycle messages.
     */
    public enum BookingStatus {
        CONFIRMED,
        CANCELLED
    }
}
