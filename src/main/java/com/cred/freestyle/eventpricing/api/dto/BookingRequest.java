package com.cred.freestyle.eventpricing.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for booking tickets.
 * Ticket count range and email format are checked by the booking coordinator.
 *
 * @author Event Pricing Team
 */
public class BookingRequest {

    @NotBlank(message = "Event ID is required")
    private String eventId;

    @NotBlank(message = "Customer email is required")
    private String customerEmail;

    @NotNull(message = "Ticket count is required")
    private Integer ticketCount;

    public BookingRequest() {
    }

    public BookingRequest(String eventId, String customerEmail, Integer ticketCount) {
        this.eventId = eventId;
        this.customerEmail = customerEmail;
        this.ticketCount = ticketCount;
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
}
