package com.cred.freestyle.eventpricing.api.dto;

import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.model.PricingRuleSet;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request DTO for creating an event.
 * Price ordering, event date and pricing rules are validated by the event service.
 *
 * @author Event Pricing Team
 */
public class CreateEventRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @NotBlank(message = "Venue is required")
    @Size(max = 255, message = "Venue must be at most 255 characters")
    private String venue;

    private String description;

    @NotNull(message = "Event date is required")
    private Instant eventDate;

    @NotNull(message = "Capacity is required")
    @Positive(message = "Capacity must be positive")
    private Integer capacity;

    @NotNull(message = "Base price is required")
    @Positive(message = "Base price must be positive")
    private BigDecimal basePrice;

    @NotNull(message = "Floor price is required")
    @Positive(message = "Floor price must be positive")
    private BigDecimal floorPrice;

    @NotNull(message = "Ceiling price is required")
    @Positive(message = "Ceiling price must be positive")
    private BigDecimal ceilingPrice;

    /**
     * Optional; defaults apply when absent.
     */
    private PricingRuleSet pricingRules;

    public CreateEventRequest() {
    }

    public Event toEntity() {
        return Event.builder()
                .name(name.trim())
                .venue(venue.trim())
                .description(description)
                .eventDate(eventDate)
                .capacity(capacity)
                .basePrice(basePrice)
                .floorPrice(floorPrice)
                .ceilingPrice(ceilingPrice)
                .pricingRules(pricingRules)
                .build();
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

    public BigDecimal getBasePrice() {
        return basePrice;
    }

    public void setBasePrice(BigDecimal basePrice) {
        this.basePrice = basePrice;
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

    public PricingRuleSet getPricingRules() {
        return pricingRules;
    }

    public void setPricingRules(PricingRuleSet pricingRules) {
        this.pricingRules = pricingRules;
    }
}
