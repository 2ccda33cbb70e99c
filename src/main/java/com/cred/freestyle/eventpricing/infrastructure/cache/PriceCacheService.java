package com.cred.freestyle.eventpricing.infrastructure.cache;

import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis cache for prices and read views of events and bookings.
 *
 * The cache is an optimization only: every Redis failure is logged and treated as a
 * miss (reads) or a no-op (writes), so pricing and booking keep working without it.
 *
 * Cache Keys:
 * - price:{event_id} -> Current price breakdown, JSON (30s)
 * - event:{event_id} -> Event snapshot, JSON (60s)
 * - events:all -> Upcoming active events, JSON (60s)
 * - event:{event_id}:bookings -> Bookings of an event, JSON (120s)
 * - event:{event_id}:stats -> Booking statistics of an event, JSON (60s)
 * - customer:{email}:bookings -> Bookings of a customer, JSON (120s)
 *
 * Every cached view has an invalidation generation: one per event (price, snapshot,
 * bookings, stats), one per customer and one for the upcoming list. A caller reads the
 * generation before it queries the database and passes it to the write. The write is
 * dropped, or undone, if an invalidation happened in between, so a committed booking or
 * cancellation is never followed by a view read before it.
 *
 * Generation entries are only created by invalidations, which follow committed writes,
 * so lookups of unknown ids leave no state behind. A missing entry reads as 0.
 *
 * @author Event Pricing Team
 */
@Service
public class PriceCacheService {

    private static final Logger logger = LoggerFactory.getLogger(PriceCacheService.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    // Bumped by clearAll; part of every generation so a clear invalidates all in-flight reads
    private final AtomicLong clearEpoch = new AtomicLong();

    // Cache key prefixes
    private static final String PRICE_PREFIX = "price:";
    private static final String EVENT_PREFIX = "event:";
    private static final String EVENTS_ALL_KEY = "events:all";
    private static final String CUSTOMER_PREFIX = "customer:";
    private static final String BOOKINGS_SUFFIX = ":bookings";
    private static final String STATS_SUFFIX = ":stats";

    // Cache TTL durations
    private static final Duration PRICE_TTL = Duration.ofSeconds(30);
    private static final Duration EVENT_TTL = Duration.ofSeconds(60);
    private static final Duration LIST_TTL = Duration.ofSeconds(120);
    private static final Duration STATS_TTL = Duration.ofSeconds(60);

    public PriceCacheService(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Invalidation generation of an event. Read it before loading or computing anything
     * that will be cached under the event's keys.
     *
     * @param eventId Event ID
     * @return Current generation
     */
    public long currentGeneration(String eventId) {
        return generationOf(EVENT_PREFIX + eventId);
    }

    public long currentUpcomingGeneration() {
        return generationOf(EVENTS_ALL_KEY);
    }

    public long currentCustomerGeneration(String customerEmail) {
        return generationOf(CUSTOMER_PREFIX + customerEmail);
    }

    /**
     * Get cached price breakdown.
     *
     * @param eventId Event ID
     * @return Optional containing the breakdown if cached
     */
    public Optional<PriceBreakdown> getPrice(String eventId) {
        return readJson(PRICE_PREFIX + eventId, objectMapper.constructType(PriceBreakdown.class));
    }

    /**
     * Cache a price computed while the event was at the given generation.
     * Dropped if the event was invalidated in the meantime.
     *
     * @param eventId Event ID
     * @param breakdown Price breakdown to cache
     * @param observedGeneration Generation read before the price was computed
     * @return true if the price was written and is still valid
     */
    public boolean setPrice(String eventId, PriceBreakdown breakdown, long observedGeneration) {
        boolean written = writeIfCurrent(PRICE_PREFIX + eventId, breakdown, PRICE_TTL,
                EVENT_PREFIX + eventId, observedGeneration);
        if (written) {
            logger.debug("Cached price for {}: {}", eventId, breakdown.getFinalPrice());
        }
        return written;
    }

    public <T> Optional<T> getEvent(String eventId, Class<T> clazz) {
        return readJson(EVENT_PREFIX + eventId, objectMapper.constructType(clazz));
    }

    public <T> boolean cacheEvent(String eventId, T event, long observedGeneration) {
        return writeIfCurrent(EVENT_PREFIX + eventId, event, EVENT_TTL,
                EVENT_PREFIX + eventId, observedGeneration);
    }

    public <T> Optional<List<T>> getUpcomingEvents(Class<T> clazz) {
        return readJson(EVENTS_ALL_KEY, listOf(clazz));
    }

    public <T> boolean cacheUpcomingEvents(List<T> events, long observedGeneration) {
        return writeIfCurrent(EVENTS_ALL_KEY, events, EVENT_TTL, EVENTS_ALL_KEY, observedGeneration);
    }

    public <T> Optional<List<T>> getEventBookings(String eventId, Class<T> clazz) {
        return readJson(EVENT_PREFIX + eventId + BOOKINGS_SUFFIX, listOf(clazz));
    }

    public <T> boolean cacheEventBookings(String eventId, List<T> bookings, long observedGeneration) {
        return writeIfCurrent(EVENT_PREFIX + eventId + BOOKINGS_SUFFIX, bookings, LIST_TTL,
                EVENT_PREFIX + eventId, observedGeneration);
    }

    public <T> Optional<List<T>> getCustomerBookings(String customerEmail, Class<T> clazz) {
        return readJson(CUSTOMER_PREFIX + customerEmail + BOOKINGS_SUFFIX, listOf(clazz));
    }

    public <T> boolean cacheCustomerBookings(String customerEmail, List<T> bookings, long observedGeneration) {
        return writeIfCurrent(CUSTOMER_PREFIX + customerEmail + BOOKINGS_SUFFIX, bookings, LIST_TTL,
                CUSTOMER_PREFIX + customerEmail, observedGeneration);
    }

    public <T> Optional<T> getEventStats(String eventId, Class<T> clazz) {
        return readJson(EVENT_PREFIX + eventId + STATS_SUFFIX, objectMapper.constructType(clazz));
    }

    public <T> boolean cacheEventStats(String eventId, T stats, long observedGeneration) {
        return writeIfCurrent(EVENT_PREFIX + eventId + STATS_SUFFIX, stats, STATS_TTL,
                EVENT_PREFIX + eventId, observedGeneration);
    }

    /**
     * Invalidate everything derived from an event's inventory or price.
     * Called after every committed booking, cancellation and price refresh.
     *
     * @param eventId Event ID
     */
    public void invalidateEvent(String eventId) {
        bump(EVENT_PREFIX + eventId);
        bump(EVENTS_ALL_KEY);
        try {
            redisTemplate.delete(List.of(
                    PRICE_PREFIX + eventId,
                    EVENT_PREFIX + eventId,
                    EVENTS_ALL_KEY,
                    EVENT_PREFIX + eventId + BOOKINGS_SUFFIX,
                    EVENT_PREFIX + eventId + STATS_SUFFIX
            ));
            logger.debug("Invalidated cache for event: {}", eventId);
        } catch (Exception e) {
            logger.error("Error invalidating cache for event: {}", eventId, e);
        }
    }

    public void invalidateCustomer(String customerEmail) {
        bump(CUSTOMER_PREFIX + customerEmail);
        try {
            redisTemplate.delete(CUSTOMER_PREFIX + customerEmail + BOOKINGS_SUFFIX);
            logger.debug("Invalidated booking cache for customer: {}", customerEmail);
        } catch (Exception e) {
            logger.error("Error invalidating booking cache for customer: {}", customerEmail, e);
        }
    }

    public void invalidateUpcomingEvents() {
        bump(EVENTS_ALL_KEY);
        try {
            redisTemplate.delete(EVENTS_ALL_KEY);
        } catch (Exception e) {
            logger.error("Error invalidating upcoming events cache", e);
        }
    }

    /**
     * Remove every key this service owns. Rate limit keys are left alone.
     *
     * @return Number of keys removed
     */
    public long clearAll() {
        clearEpoch.incrementAndGet();
        try {
            List<String> keys = new ArrayList<>();
            for (String pattern : List.of(PRICE_PREFIX + "*", EVENT_PREFIX + "*", EVENTS_ALL_KEY, CUSTOMER_PREFIX + "*")) {
                Set<String> matched = redisTemplate.keys(pattern);
                if (matched != null) {
                    keys.addAll(matched);
                }
            }
            if (keys.isEmpty()) {
                return 0;
            }
            Long removed = redisTemplate.delete(keys);
            logger.warn("Cleared {} price cache entries", removed);
            return removed != null ? removed : 0;
        } catch (Exception e) {
            logger.error("Error clearing price cache", e);
            return 0;
        }
    }

    // Both parts only grow, so the sum changes whenever either is bumped
    private long generationOf(String scope) {
        AtomicLong generation = generations.get(scope);
        return clearEpoch.get() + (generation != null ? generation.get() : 0);
    }

    private void bump(String scope) {
        generations.computeIfAbsent(scope, key -> new AtomicLong()).incrementAndGet();
    }

    int trackedGenerations() {
        return generations.size();
    }

    private JavaType listOf(Class<?> clazz) {
        return objectMapper.getTypeFactory().constructCollectionType(List.class, clazz);
    }

    private <T> Optional<T> readJson(String key, JavaType type) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json != null) {
                logger.debug("Cache hit for key: {}", key);
                return Optional.of(objectMapper.readValue(json, type));
            }
            logger.debug("Cache miss for key: {}", key);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error reading {} from cache", key, e);
            return Optional.empty();
        }
    }

    /**
     * Write a value read while its scope was at the observed generation. Skipped if the scope
     * was invalidated since, and deleted again if an invalidation ran during the write.
     */
    private boolean writeIfCurrent(String key, Object value, Duration ttl, String scope, long observedGeneration) {
        if (generationOf(scope) != observedGeneration) {
            logger.debug("Skipping stale {}: generation moved past {}", key, observedGeneration);
            return false;
        }
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
            if (generationOf(scope) != observedGeneration) {
                redisTemplate.delete(key);
                logger.debug("Removed {} written across an invalidation", key);
                return false;
            }
            logger.debug("Cached {}", key);
            return true;
        } catch (Exception e) {
            logger.error("Error caching {}", key, e);
            return false;
        }
    }
}
