package com.cred.freestyle.eventpricing.infrastructure.messaging.events;

import com.cred.freestyle.eventpricing.domain.model.Booking;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Message describing a committed change to a booking.
 * Published to Kafka after the transaction commits, keyed by event ID.
 *
 * Event Types:
 * - BOOKING_CONFIRMED: Booking created, tickets taken from the event
 * - BOOKING_CANCELLED: Booking cancelled, tickets returned to the event
 *
 * @author Event Pricing Team
 */
public class BookingLifecycleEvent {

    private String bookingId;
    private String eventId;
    private String customerEmail;
    private Integer ticketCount;
    private BigDecimal pricePerTicket;
    private BigDecimal totalAmount;
    private BigDecimal eventPrice;
    private EventType eventType;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public BookingLifecycleEvent() {
    }

    /**
     * @param booking Booking the message is about
     * @param eventPrice Event price after the change
     * @param eventType Event type
     */
    public BookingLifecycleEvent(Booking booking, BigDecimal eventPrice, EventType eventType) {
        this.bookingId = booking.getBookingId();
        this.eventId = booking.getEventId();
        this.customerEmail = booking.getCustomerEmail();
        this.ticketCount = booking.getTicketCount();
        this.pricePerTicket = booking.getPricePerTicket();
        this.totalAmount = booking.getTotalAmount();
        this.eventPrice = eventPrice;
        this.eventType = eventType;
        this.timestamp = Instant.now();
    }

    // Getters and setters
    public String getBookingId() {
        return bookingId;
    }

    public void setBookingId(String bookingId) {
        this.bookingId = bookingId;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getCustomerEmail() {
        return customerEmail;
    }

    public void setCustomerEmail(String customerEmail) {
        this.customerEmail = customerEmail;
    }

    public Integer getTicketCount() {
        return ticketCount;
    }

    public void setTicketCount(Integer ticketCount) {
        this.ticketCount = ticketCount;
    }

    public BigDecimal getPricePerTicket() {
        return pricePerTicket;
    }

    public void setPricePerTicket(BigDecimal pricePerTicket) {
        this.pricePerTicket = pricePerTicket;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(BigDecimal totalAmount) {
        this.totalAmount = totalAmount;
    }

    public BigDecimal getEventPrice() {
        return eventPrice;
    }

    public void setEventPrice(BigDecimal eventPrice) {
        this.eventPrice = eventPrice;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Booking lifecycle event types.
     */
    public enum EventType {
        BOOKING_CONFIRMED,
        BOOKING_CANCELLED
    }
}
