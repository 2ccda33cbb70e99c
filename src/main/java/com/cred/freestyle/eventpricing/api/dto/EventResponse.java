package com.cred.freestyle.eventpricing.api.dto;

import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.model.PricingRuleSet;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for event operations (admin views).
 *
 * @author Event Pricing Team
 */
public class EventResponse {

    private String eventId;
    private String name;
    private String venue;
    private String description;
    private Instant eventDate;
    private Integer capacity;
    private Integer bookedTickets;
    private Integer availableTickets;
    private BigDecimal basePrice;
    private BigDecimal currentPrice;
    private BigDecimal floorPrice;
    private BigDecimal ceilingPrice;
    private boolean active;
    private PricingRuleSet pricingRules;
    private Instant createdAt;
    private Instant updatedAt;

    public EventResponse() {
    }

    public static EventResponse fromEntity(Event event) {
        EventResponse response = new EventResponse();
        response.setEventId(event.getEventId());
        response.setName(event.getName());
        response.setVenue(event.getVenue());
        response.setDescription(event.getDescription());
        response.setEventDate(event.getEventDate());
        response.setCapacity(event.getCapacity());
        response.setBookedTickets(event.getBookedTickets());
        response.setAvailableTickets(Math.max(0, event.getCapacity() - event.getBookedTickets()));
        response.setBasePrice(event.getBasePrice());
        response.setCurrentPrice(event.getCurrentPrice());
        response.setFloorPrice(event.getFloorPrice());
        response.setCeilingPrice(event.getCeilingPrice());
        response.setActive(Boolean.TRUE.equals(event.getIsActive()));
        response.setPricingRules(event.getPricingRules());
        response.setCreatedAt(event.getCreatedAt());
        response.setUpdatedAt(event.getUpdatedAt());
        return response;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVenue() {
        return venue;
    }

    public void setVenue(String venue) {
        this.venue = venue;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getEventDate() {
        return eventDate;
    }

    public void setEventDate(Instant eventDate) {
        this.eventDate = eventDate;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
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

    public BigDecimal getBasePrice() {
        return basePrice;
    }

    public void setBasePrice(BigDecimal basePrice) {
        this.basePrice = basePrice;
    }

    public BigDecimal getCurrentPrice() {
        return currentPrice;
    }

    public void setCurrentPrice(BigDecimal currentPrice) {
        this.currentPrice = currentPrice;
    }

    public BigDecimal getFloorPrice() {
        return floorPrice;
    }

    public void setFloorPrice(BigDecimal floorPrice) {
        this.floorPrice = floorPrice;
    }

    public BigDecimal getCeilingPrice() {
        return ceilingPrice;
    }

    public void setCeilingPrice(BigDecimal ceilingPrice) {
        this.ceilingPrice = ceilingPrice;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public PricingRuleSet getPricingRules() {
        return pricingRules;
    }

    public void setPricingRules(PricingRuleSet pricingRules) {
        this.pricingRules = pricingRules;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
