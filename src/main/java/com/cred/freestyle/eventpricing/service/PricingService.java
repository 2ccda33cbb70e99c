package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.cred.freestyle.eventpricing.domain.pricing.PriceModel;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.infrastructure.cache.PriceCacheService;
import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for event prices.
 *
 * - getCurrentPrice: cache-first price breakdown for display
 * - prepareQuote / resolvePrice: price resolution inside a booking or cancellation
 * - refreshPrice / refreshAllPrices: recompute and persist the current price of events
 *
 * @author Event Pricing Team
 */
@Service
public class PricingService {

    private static final Logger logger = LoggerFactory.getLogger(PricingService.class);

    private final EventRepository eventRepository;
    private final PriceModel priceModel;
    private final DemandSignal demandSignal;
    private final PriceCacheService cacheService;
    private final InventoryLedger inventoryLedger;
    private final PricingMetricsService metricsService;

    public PricingService(
            EventRepository eventRepository,
            PriceModel priceModel,
            DemandSignal demandSignal,
            PriceCacheService cacheService,
            InventoryLedger inventoryLedger,
            PricingMetricsService metricsService
    ) {
        this.eventRepository = eventRepository;
        this.priceModel = priceModel;
        this.demandSignal = demandSignal;
        this.cacheService = cacheService;
        this.inventoryLedger = inventoryLedger;
        this.metricsService = metricsService;
    }

    /**
     * Current price of an event with its breakdown.
     * Served from cache when possible, otherwise computed from the event's committed state
     * and cached for 30 seconds.
     *
     * @param eventId Event ID
     * @return Price breakdown
     * @throws ResourceNotFoundException if the event does not exist
     */
    public PriceBreakdown getCurrentPrice(String eventId) {
        long generation = cacheService.currentGeneration(eventId);
        Optional<PriceBreakdown> cached = cacheService.getPrice(eventId);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("price");
            return cached.get();
        }
        metricsService.recordCacheMiss("price");

        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        Instant now = Instant.now();
        PriceBreakdown breakdown = priceModel.computePrice(event, demandSignal.recentBookingCount(eventId, now), now);
        cacheService.setPrice(eventId, breakdown, generation);
        metricsService.recordComputedPrice(eventId, breakdown.getFinalPrice());

        logger.debug("Computed price for event {}: {}", eventId, breakdown.getFinalPrice());
        return breakdown;
    }

    /**
     * First half of price resolution for a booking, run under the pool lock before the
     * transaction opens: take the cached price if there is one, otherwise read the demand signal.
     *
     * @param eventId Event ID
     * @param now Pricing instant
     * @return Quote to resolve against the locked event
     */
    public PriceQuote prepareQuote(String eventId, Instant now) {
        long generation = cacheService.currentGeneration(eventId);
        Optional<PriceBreakdown> cached = cacheService.getPrice(eventId);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("price");
            return PriceQuote.cached(cached.get());
        }
        metricsService.recordCacheMiss("price");
        return PriceQuote.toCompute(generation, demandSignal.recentBookingCount(eventId, now), now);
    }

    /**
     * Second half of price resolution, run on the locked event: the cached price as is,
     * or a fresh price from the locked state, which is then cached.
     *
     * @param quote Quote from {@link #prepareQuote(String, Instant)}
     * @param event Event read under the pool lock
     * @return Price breakdown to charge
     */
    public PriceBreakdown resolvePrice(PriceQuote quote, Event event) {
        if (quote.getCached() != null) {
            return quote.getCached();
        }
        PriceBreakdown breakdown = priceModel.computePrice(event, quote.getDemandCount(), quote.getNow());
        cacheService.setPrice(event.getEventId(), breakdown, quote.getGeneration());
        metricsService.recordComputedPrice(event.getEventId(), breakdown.getFinalPrice());
        return breakdown;
    }

    /**
     * Recompute a locked event's price, ignoring the cache.
     *
     * @param event Event read under the pool lock
     * @param demandCount Demand signal
     * @param now Pricing instant
     * @return Fresh price breakdown
     */
    public PriceBreakdown computeFresh(Event event, long demandCount, Instant now) {
        PriceBreakdown breakdown = priceModel.computePrice(event, demandCount, now);
        metricsService.recordComputedPrice(event.getEventId(), breakdown.getFinalPrice());
        return breakdown;
    }

    /**
     * Recompute and persist the current price of an event under its pool lock.
     *
     * @param eventId Event ID
     * @return The persisted price breakdown
     * @throws ResourceNotFoundException if the event does not exist
     */
    public PriceBreakdown refreshPrice(String eventId) {
        PriceBreakdown breakdown = inventoryLedger.withPoolLock(eventId, new InventoryLedger.PoolTransaction<PriceBreakdown>() {
            private long demandCount;
            private Instant now;

            @Override
            public void prepare() {
                now = Instant.now();
                demandCount = demandSignal.recentBookingCount(eventId, now);
            }

            @Override
            public PriceBreakdown execute(Event event) {
                PriceBreakdown fresh = computeFresh(event, demandCount, now);
                event.setCurrentPrice(fresh.getFinalPrice());
                return fresh;
            }

            @Override
            public void afterCommit(PriceBreakdown result) {
                cacheService.invalidateEvent(eventId);
            }
        });

        logger.info("Refreshed price for event {}: {}", eventId, breakdown.getFinalPrice());
        return breakdown;
    }

    /**
     * Refresh the price of every active upcoming event, or of the given events only.
     * A failure on one event is logged and does not stop the others.
     *
     * @param eventIds Events to refresh, or null/empty for all active upcoming events
     * @return Outcome counts
     */
    public PriceRefreshSummary refreshAllPrices(List<String> eventIds) {
        List<String> targets = eventIds == null || eventIds.isEmpty()
                ? eventRepository.findUpcomingActiveEventIds(Instant.now())
                : eventIds;

        List<String> failed = new ArrayList<>();
        int refreshed = 0;
        for (String eventId : targets) {
            try {
                refreshPrice(eventId);
                refreshed++;
            } catch (RuntimeException e) {
                logger.error("Failed to refresh price for event {}", eventId, e);
                metricsService.recordError("PRICE_REFRESH_ERROR", "refreshAllPrices");
                failed.add(eventId);
            }
        }

        logger.info("Price refresh finished: {} refreshed, {} failed", refreshed, failed.size());
        return new PriceRefreshSummary(targets.size(), refreshed, failed);
    }

    /**
     * Price resolution state carried from the prepare step into the locked transaction.
     */
    public static class PriceQuote {
        private final PriceBreakdown cached;
        private final long generation;
        private final long demandCount;
        private final Instant now;

        private PriceQuote(PriceBreakdown cached, long generation, long demandCount, Instant now) {
            this.cached = cached;
            this.generation = generation;
            this.demandCount = demandCount;
            this.now = now;
        }

        static PriceQuote cached(PriceBreakdown breakdown) {
            return new PriceQuote(breakdown, 0, 0, breakdown.getComputedAt());
        }

        static PriceQuote toCompute(long generation, long demandCount, Instant now) {
            return new PriceQuote(null, generation, demandCount, now);
        }

        public PriceBreakdown getCached() {
            return cached;
        }

        public long getGeneration() {
            return generation;
        }

        public long getDemandCount() {
            return demandCount;
        }

        public Instant getNow() {
            return now;
        }
    }

    /**
     * Result of a batch price refresh.
     */
    public static class PriceRefreshSummary {
        private final int total;
        private final int refreshed;
        private final List<String> failedEventIds;

        public PriceRefreshSummary(int total, int refreshed, List<String> failedEventIds) {
            this.total = total;
            this.refreshed = refreshed;
            this.failedEventIds = failedEventIds;
        }

        public int getTotal() {
            return total;
        }

        public int getRefreshed() {
            return refreshed;
        }

        public List<String> getFailedEventIds() {
            return failedEventIds;
        }
    }
}
