package com.cred.freestyle.eventpricing.api.controller;

import com.cred.freestyle.eventpricing.api.dto.CreateEventRequest;
import com.cred.freestyle.eventpricing.api.dto.EventAvailabilityResponse;
import com.cred.freestyle.eventpricing.api.dto.EventResponse;
import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.cred.freestyle.eventpricing.service.EventService;
import com.cred.freestyle.eventpricing.service.PricingService;
import com.cred.freestyle.eventpricing.service.PricingService.PriceRefreshSummary;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for events and their prices.
 *
 * Price and availability are public. Listing, creating, re-pricing and cache
 * management are admin operations (see SecurityConfig).
 *
 * @author Event Pricing Team
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final EventService eventService;
    private final PricingService pricingService;

    public EventController(EventService eventService, PricingService pricingService) {
        this.eventService = eventService;
        this.pricingService = pricingService;
    }

    /**
     * Current price of an event with the contribution of every pricing rule.
     * This is a high-traffic endpoint; it is served from cache for up to 30 seconds.
     *
     * @param eventId Event ID
     * @return Price breakdown
     */
    @GetMapping("/{eventId}/price")
    public ResponseEntity<PriceBreakdown> getCurrentPrice(@PathVariable String eventId) {
        return ResponseEntity.ok(pricingService.getCurrentPrice(eventId));
    }

    @GetMapping("/{eventId}/availability")
    public ResponseEntity<EventAvailabilityResponse> getAvailability(@PathVariable String eventId) {
        return ResponseEntity.ok(EventAvailabilityResponse.from(eventService.getAvailability(eventId)));
    }

    /**
     * Active events that have not started yet, soonest first.
     */
    @GetMapping
    public ResponseEntity<List<EventResponse>> getUpcomingEvents() {
        List<EventResponse> events = eventService.getUpcomingEvents().stream()
                .map(EventResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(events);
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(eventService.findEvent(eventId)));
    }

    @PostMapping
    public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody CreateEventRequest request) {
        Event event = eventService.createEvent(request.toEntity());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.fromEntity(event));
    }

    /**
     * Recompute and persist the current price of one event.
     *
     * @param eventId Event ID
     * @return The new price breakdown
     */
    @PatchMapping("/{eventId}/price")
    public ResponseEntity<PriceBreakdown> refreshPrice(@PathVariable String eventId) {
        logger.info("Price refresh requested for event {}", eventId);
        return ResponseEntity.ok(pricingService.refreshPrice(eventId));
    }

    /**
     * Recompute and persist the current price of every active upcoming event.
     */
    @PostMapping("/prices/refresh")
    public ResponseEntity<PriceRefreshSummary> refreshAllPrices() {
        logger.info("Price refresh requested for all upcoming events");
        return ResponseEntity.ok(pricingService.refreshAllPrices(null));
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        long removed = eventService.clearCache();
        return ResponseEntity.ok(Map.of(
                "message", "Cache cleared successfully",
                "keysRemoved", removed
        ));
    }
}
