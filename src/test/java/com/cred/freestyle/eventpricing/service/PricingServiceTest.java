package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.cred.freestyle.eventpricing.domain.pricing.PriceModel;
import com.cred.freestyle.eventpricing.exception.PoolBusyException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.infrastructure.cache.PriceCacheService;
import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.EventRepository;
import com.cred.freestyle.eventpricing.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PricingService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PricingService Unit Tests")
class PricingServiceTest {

    private static final String EVENT_ID = "event-001";

    @Mock
    private EventRepository eventRepository;

    @Mock
    private PriceModel priceModel;

    @Mock
    private DemandSignal demandSignal;

    @Mock
    private PriceCacheService cacheService;

    @Mock
    private InventoryLedger inventoryLedger;

    @Mock
    private PricingMetricsService metricsService;

    @InjectMocks
    private PricingService pricingService;

    private Event event;
    private PriceBreakdown breakdown;

    @BeforeEach
    void setUp() {
        event = TestDataBuilder.event().eventId(EVENT_ID).build();
        breakdown = PriceBreakdown.builder()
                .eventId(EVENT_ID)
                .finalPrice(new BigDecimal("115.00"))
                .computedAt(Instant.now())
                .build();
    }

    @SuppressWarnings("unchecked")
    private void runPoolTransactionsOn(Event locked) {
        when(inventoryLedger.withPoolLock(any(String.class), any(InventoryLedger.PoolTransaction.class)))
                .thenAnswer(inv -> {
                    InventoryLedger.PoolTransaction<Object> work = inv.getArgument(1);
                    work.prepare();
                    Object result = work.execute(locked);
                    work.afterCommit(result);
                    return result;
                });
    }

    // ========================================
    // getCurrentPrice Tests
    // ========================================

    @Test
    @DisplayName("getCurrentPrice - Cache hit is returned without touching the database")
    void getCurrentPrice_CacheHit() {
        // Given
        when(cacheService.getPrice(EVENT_ID)).thenReturn(Optional.of(breakdown));

        // When
        PriceBreakdown result = pricingService.getCurrentPrice(EVENT_ID);

        // Then
        assertThat(result).isSameAs(breakdown);
        verify(metricsService).recordCacheHit("price");
        verify(eventRepository, never()).findById(any());
        verify(priceModel, never()).computePrice(any(), anyLong(), any());
    }

    @Test
    @DisplayName("getCurrentPrice - Cache miss computes and caches with the generation read first")
    void getCurrentPrice_CacheMiss_ComputesAndCaches() {
        // Given
        when(cacheService.currentGeneration(EVENT_ID)).thenReturn(7L);
        when(cacheService.getPrice(EVENT_ID)).thenReturn(Optional.empty());
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(demandSignal.recentBookingCount(eq(EVENT_ID), any(Instant.class))).thenReturn(4L);
        when(priceModel.computePrice(eq(event), eq(4L), any(Instant.class))).thenReturn(breakdown);

        // When
        PriceBreakdown result = pricingService.getCurrentPrice(EVENT_ID);

        // Then
        assertThat(result.getFinalPrice()).isEqualByComparingTo("115.00");
        verify(cacheService).setPrice(EVENT_ID, breakdown, 7L);
        verify(metricsService).recordCacheMiss("price");
        verify(metricsService).recordComputedPrice(EVENT_ID, breakdown.getFinalPrice());
    }

    @Test
    @DisplayName("getCurrentPrice - Unknown event throws ResourceNotFoundException")
    void getCurrentPrice_EventNotFound_Throws() {
        when(cacheService.getPrice("missing")).thenReturn(Optional.empty());
        when(eventRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> pricingService.getCurrentPrice("missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Event with ID missing not found");
    }

    // ========================================
    // prepareQuote / resolvePrice Tests
    // ========================================

    @Test
    @DisplayName("prepareQuote / resolvePrice - Cached price is charged as is")
    void resolvePrice_CachedQuote_ReturnsCached() {
        when(cacheService.getPrice(EVENT_ID)).thenReturn(Optional.of(breakdown));

        PricingService.PriceQuote quote = pricingService.prepareQuote(EVENT_ID, Instant.now());
        PriceBreakdown result = pricingService.resolvePrice(quote, event);

        assertThat(result).isSameAs(breakdown);
        verify(demandSignal, never()).recentBookingCount(any(), any());
        verify(cacheService, never()).setPrice(any(), any(), anyLong());
    }

    @Test
    @DisplayName("prepareQuote / resolvePrice - Cache miss prices the locked event and caches it")
    void resolvePrice_ComputeQuote_PricesLockedEvent() {
        // Given
        Instant now = Instant.now();
        when(cacheService.currentGeneration(EVENT_ID)).thenReturn(3L);
        when(cacheService.getPrice(EVENT_ID)).thenReturn(Optional.empty());
        when(demandSignal.recentBookingCount(EVENT_ID, now)).thenReturn(12L);
        when(priceModel.computePrice(event, 12L, now)).thenReturn(breakdown);

        // When
        PricingService.PriceQuote quote = pricingService.prepareQuote(EVENT_ID, now);
        PriceBreakdown result = pricingService.resolvePrice(quote, event);

        // Then
        assertThat(quote.getCached()).isNull();
        assertThat(quote.getDemandCount()).isEqualTo(12L);
        assertThat(result).isSameAs(breakdown);
        verify(cacheService).setPrice(EVENT_ID, breakdown, 3L);
    }

    // ========================================
    // refreshPrice / refreshAllPrices Tests
    // ========================================

    @Test
    @DisplayName("refreshPrice - Persists the fresh price and invalidates the event's caches")
    void refreshPrice_PersistsAndInvalidates() {
        // Given
        runPoolTransactionsOn(event);
        when(demandSignal.recentBookingCount(eq(EVENT_ID), any(Instant.class))).thenReturn(0L);
        when(priceModel.computePrice(eq(event), eq(0L), any(Instant.class))).thenReturn(breakdown);

        // When
        PriceBreakdown result = pricingService.refreshPrice(EVENT_ID);

        // Then
        assertThat(result.getFinalPrice()).isEqualByComparingTo("115.00");
        assertThat(event.getCurrentPrice()).isEqualByComparingTo("115.00");
        verify(cacheService).invalidateEvent(EVENT_ID);
    }

    @Test
    @DisplayName("refreshAllPrices - Null list refreshes every active upcoming event")
    void refreshAllPrices_AllUpcoming() {
        // Given
        when(eventRepository.findUpcomingActiveEventIds(any(Instant.class)))
                .thenReturn(Arrays.asList(EVENT_ID, "event-002"));
        when(inventoryLedger.withPoolLock(eq(EVENT_ID), any(InventoryLedger.PoolTransaction.class)))
                .thenReturn(breakdown);
        when(inventoryLedger.withPoolLock(eq("event-002"), any(InventoryLedger.PoolTransaction.class)))
                .thenReturn(breakdown);

        // When
        PricingService.PriceRefreshSummary summary = pricingService.refreshAllPrices(null);

        // Then
        assertThat(summary.getTotal()).isEqualTo(2);
        assertThat(summary.getRefreshed()).isEqualTo(2);
        assertThat(summary.getFailedEventIds()).isEmpty();
    }

    @Test
    @DisplayName("refreshAllPrices - One failing event does not stop the others")
    void refreshAllPrices_PartialFailure() {
        // Given
        List<String> ids = Arrays.asList("event-busy", EVENT_ID);
        when(inventoryLedger.withPoolLock(eq("event-busy"), any(InventoryLedger.PoolTransaction.class)))
                .thenThrow(new PoolBusyException("event-busy", 5000));
        when(inventoryLedger.withPoolLock(eq(EVENT_ID), any(InventoryLedger.PoolTransaction.class)))
                .thenReturn(breakdown);

        // When
        PricingService.PriceRefreshSummary summary = pricingService.refreshAllPrices(ids);

        // Then
        assertThat(summary.getTotal()).isEqualTo(2);
        assertThat(summary.getRefreshed()).isEqualTo(1);
        assertThat(summary.getFailedEventIds()).containsExactly("event-busy");
        verify(metricsService).recordError("PRICE_REFRESH_ERROR", "refreshAllPrices");
        verify(eventRepository, never()).findUpcomingActiveEventIds(any());
    }

    @Test
    @DisplayName("refreshAllPrices - No upcoming events gives an empty summary")
    void refreshAllPrices_NothingToRefresh() {
        when(eventRepository.findUpcomingActiveEventIds(any(Instant.class))).thenReturn(Collections.emptyList());

        PricingService.PriceRefreshSummary summary = pricingService.refreshAllPrices(Collections.emptyList());

        assertThat(summary.getTotal()).isZero();
        assertThat(summary.getRefreshed()).isZero();
    }
}
