package com.cred.freestyle.eventpricing.api.dto;

import com.cred.freestyle.eventpricing.domain.model.Booking;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a booking.
 *
 * @author Event Pricing Team
 */
public class BookingResponse {

    private String bookingId;
    private String eventId;
    private String customerEmail;
    private Integer ticketCount;
    private BigDecimal pricePerTicket;
    private BigDecimal totalAmount;
    private String status;
    private Instant createdAt;

    public BookingResponse() {
    }

    public static BookingResponse fromEntity(Booking booking) {
        BookingResponse response = new BookingResponse();
        response.setBookingId(booking.getBookingId());
        response.setEventId(booking.getEventId());
        response.setCustomerEmail(booking.getCustomerEmail());
        response.setTicketCount(booking.getTicketCount());
        response.setPricePerTicket(booking.getPricePerTicket());
        response.setTotalAmount(booking.getTotalAmount());
        response.setStatus(booking.getStatus().name());
        response.setCreatedAt(booking.getCreatedAt());
        return response;
    }

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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
