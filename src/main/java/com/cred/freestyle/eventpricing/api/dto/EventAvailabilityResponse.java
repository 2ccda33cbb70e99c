package com.cred.freestyle.eventpricing.api.dto;

import com.cred.freestyle.eventpricing.service.EventService.EventAvailability;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for event ticket availability.
 *
 * @author Event Pricing Team
 */
public class EventAvailabilityResponse {

    private String eventId;
    private Integer totalCapacity;
    private Integer bookedTickets;
    private Integer availableTickets;

    @JsonProperty("isSoldOut")
    private boolean soldOut;

    /**
     * Share of capacity already booked, in percent.
     */
    private BigDecimal availabilityPercentage;

    private BigDecimal currentPrice;

    @JsonProperty("isActive")
    private boolean active;

    private Instant eventDate;

    public EventAvailabilityResponse() {
    }

    public static EventAvailabilityResponse from(EventAvailability availability) {
        EventAvailabilityResponse response = new EventAvailabilityResponse();
        response.setEventId(availability.getEventId());
        response.setTotalCapacity(availability.getTotalCapacity());
        response.setBookedTickets(availability.getBookedTickets());
        response.setAvailableTickets(availability.getAvailableTickets());
        response.setSoldOut(availability.isSoldOut());
        response.setAvailabilityPercentage(availability.getAvailabilityPercentage());
        response.setCurrentPrice(availability.getCurrentPrice());
        response.setActive(availability.isActive());
        response.setEventDate(availability.getEventDate());
        return response;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public Integer getTotalCapacity() {
        return totalCapacity;
    }

    public void setTotalCapacity(Integer totalCapacity) {
        this.totalCapacity = totalCapacity;
    }

    public Integer getBookedTickets() {
        return bookedTickets;
    }

    public void setBookedTickets(Integer bookedTickets) {
        this.bookedTickets = bookedTickets;
    }

    public Integer getAvailableTickets() {
        return availableTickets;
    }

    public void setAvailableTickets(Integer availableTickets) {
        this.availableTickets = availableTickets;
    }

    @JsonProperty("isSoldOut")
    public boolean isSoldOut() {
        return soldOut;
    }

    public void setSoldOut(boolean soldOut) {
        this.soldOut = soldOut;
    }

    public BigDecimal getAvailabilityPercentage() {
        return availabilityPercentage;
    }

    public void setAvailabilityPercentage(BigDecimal availabilityPercentage) {
        this.availabilityPercentage = availabilityPercentage;
    }

    public BigDecimal getCurrentPrice() {
        return currentPrice;
    }

    public void setCurrentPrice(BigDecimal currentPrice) {
        this.currentPrice = currentPrice;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getEventDate() {
        return eventDate;
    }

    public void setEventDate(Instant eventDate) {
        this.eventDate = eventDate;
    }
}
