package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.model.PricingRuleSet;
import com.cred.freestyle.eventpricing.exception.InvalidEventException;
import com.cred.freestyle.eventpricing.exception.InvalidPricingRulesException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.infrastructure.cache.PriceCacheService;
import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service for managing events.
 * Handles event creation, cached event reads and availability.
 *
 * @author Event Pricing Team
 */
@Service
public class EventService {

    private static final Logger logger = LoggerFactory.getLogger(EventService.class);

    private final EventRepository eventRepository;
    private final PriceCacheService cacheService;
    private final PricingMetricsService metricsService;

    public EventService(
            EventRepository eventRepository,
            PriceCacheService cacheService,
            PricingMetricsService metricsService
    ) {
        this.eventRepository = eventRepository;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
    }

    /**
     * Create an event. Booked tickets start at 0 and the current price at the base price.
     * Events created without pricing rules get {@link PricingRuleSet#defaults()}.
     *
     * @param draft Event to create
     * @return Persisted event
     * @throws InvalidEventException if capacity, prices or date are invalid
     * @throws InvalidPricingRulesException if the pricing rules are invalid
     */
    @Transactional
    public Event createEvent(Event draft) {
        validate(draft);

        if (draft.getPricingRules() == null) {
            draft.setPricingRules(PricingRuleSet.defaults());
        }
        draft.getPricingRules().validate();

        draft.setEventId(null);
        draft.setBookedTickets(0);
        draft.setCurrentPrice(draft.getBasePrice());
        if (draft.getIsActive() == null) {
            draft.setIsActive(true);
        }

        Event saved = eventRepository.save(draft);
        cacheService.invalidateUpcomingEvents();

        logger.info("Created event {} ({}) on {} with {} tickets at base price {}",
                saved.getEventId(), saved.getName(), saved.getEventDate(), saved.getCapacity(), saved.getBasePrice());
        return saved;
    }

    /**
     * Find event by ID with caching.
     *
     * @param eventId Event ID
     * @return Event
     * @throws ResourceNotFoundException if the event does not exist
     */
    public Event findEvent(String eventId) {
        long generation = cacheService.currentGeneration(eventId);
        Optional<Event> cached = cacheService.getEvent(eventId, Event.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("event");
            return cached.get();
        }
        metricsService.recordCacheMiss("event");

        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        cacheService.cacheEvent(eventId, event, generation);
        return event;
    }

    /**
     * Active events that have not started yet, soonest first.
     *
     * @return Upcoming events
     */
    public List<Event> getUpcomingEvents() {
        long generation = cacheService.currentUpcomingGeneration();
        Optional<List<Event>> cached = cacheService.getUpcomingEvents(Event.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("events");
            return cached.get();
        }
        metricsService.recordCacheMiss("events");

        List<Event> events = eventRepository.findUpcomingActiveEvents(Instant.now());
        cacheService.cacheUpcomingEvents(events, generation);
        return events;
    }

    /**
     * Ticket availability of an event.
     *
     * @param eventId Event ID
     * @return EventAvailability
     * @throws ResourceNotFoundException if the event does not exist
     */
    public EventAvailability getAvailability(String eventId) {
        Event event = findEvent(eventId);
        int available = Math.max(0, event.getCapacity() - event.getBookedTickets());

        // booked / capacity x 100
        BigDecimal percentage = event.getCapacity() > 0
                ? BigDecimal.valueOf(event.getBookedTickets())
                    .multiply(BigDecimal.valueOf(100))
                    .divide(BigDecimal.valueOf(event.getCapacity()), 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return new EventAvailability(
                event.getEventId(),
                event.getCapacity(),
                event.getBookedTickets(),
                available,
                available == 0,
                percentage,
                event.getCurrentPrice(),
                Boolean.TRUE.equals(event.getIsActive()),
                event.getEventDate()
        );
    }

    /**
     * Drop every cached price, event and booking view.
     *
     * @return Number of keys removed
     */
    public long clearCache() {
        long removed = cacheService.clearAll();
        logger.warn("Cache cleared on request, {} keys removed", removed);
        return removed;
    }

    private void validate(Event draft) {
        if (draft.getCapacity() == null || draft.getCapacity() <= 0) {
            throw new InvalidEventException("capacity", "Capacity must be positive");
        }
        requirePositive("basePrice", draft.getBasePrice());
        requirePositive("floorPrice", draft.getFloorPrice());
        requirePositive("ceilingPrice", draft.getCeilingPrice());
        if (draft.getFloorPrice().compareTo(draft.getBasePrice()) > 0) {
            throw new InvalidEventException("floorPrice", "Floor price must not exceed base price");
        }
        if (draft.getBasePrice().compareTo(draft.getCeilingPrice()) > 0) {
            throw new InvalidEventException("ceilingPrice", "Ceiling price must not be below base price");
        }
        if (draft.getEventDate() == null || !draft.getEventDate().isAfter(Instant.now())) {
            throw new InvalidEventException("eventDate", "Event date must be in the future");
        }
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidEventException(field, field + " must be positive");
        }
    }

    /**
     * Inner class for event availability response.
     */
    public static class EventAvailability {
        private final String eventId;
        private final int totalCapacity;
        private final int bookedTickets;
        private final int availableTickets;
        private final boolean soldOut;
        private final BigDecimal availabilityPercentage;
        private final BigDecimal currentPrice;
        private final boolean active;
        private final Instant eventDate;

        public EventAvailability(
                String eventId,
                int totalCapacity,
                int bookedTickets,
                int availableTickets,
                boolean soldOut,
                BigDecimal availabilityPercentage,
                BigDecimal currentPrice,
                boolean active,
                Instant eventDate
        ) {
            this.eventId = eventId;
            this.totalCapacity = totalCapacity;
            this.bookedTickets = bookedTickets;
            this.availableTickets = availableTickets;
            this.soldOut = soldOut;
            this.availabilityPercentage = availabilityPercentage;
            this.currentPrice = currentPrice;
            this.active = active;
            this.eventDate = eventDate;
        }

        // Getters
        public String getEventId() { return eventId; }
        public int getTotalCapacity() { return totalCapacity; }
        public int getBookedTickets() { return bookedTickets; }
        public int getAvailableTickets() { return availableTickets; }
        public boolean isSoldOut() { return soldOut; }
        public BigDecimal getAvailabilityPercentage() { return availabilityPercentage; }
        public BigDecimal getCurrentPrice() { return currentPrice; }
        public boolean isActive() { return active; }
        public Instant getEventDate() { return eventDate; }
    }
}
