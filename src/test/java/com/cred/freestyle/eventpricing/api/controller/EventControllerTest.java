package com.cred.freestyle.eventpricing.api.controller;

import com.cred.freestyle.eventpricing.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.cred.freestyle.eventpricing.exception.InvalidEventException;
import com.cred.freestyle.eventpricing.exception.InvalidPricingRulesException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.service.EventService;
import com.cred.freestyle.eventpricing.service.EventService.EventAvailability;
import com.cred.freestyle.eventpricing.service.PricingService;
import com.cred.freestyle.eventpricing.service.PricingService.PriceRefreshSummary;
import com.cred.freestyle.eventpricing.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for EventController using MockMvc.
 */
@WebMvcTest(EventController.class)
@ContextConfiguration(classes = {EventController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("EventController Tests")
class EventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EventService eventService;

    @MockBean
    private PricingService pricingService;

    // ========================================
    // Price and Availability Tests
    // ========================================

    @Test
    @DisplayName("GET /events/{id}/price - Returns the price breakdown")
    void getCurrentPrice_Returns200() throws Exception {
        // Given
        PriceBreakdown breakdown = PriceBreakdown.builder()
                .eventId("event-001")
                .basePrice(new BigDecimal("100.00"))
                .finalPrice(new BigDecimal("115.00"))
                .totalAdjustment(new BigDecimal("0.149985"))
                .timeBased(new PriceBreakdown.RuleAdjustment(
                        new BigDecimal("0.1"), new BigDecimal("0.3333"), new BigDecimal("0.03333")))
                .demandCount(12)
                .build();
        when(pricingService.getCurrentPrice("event-001")).thenReturn(breakdown);

        // When / Then
        mockMvc.perform(get("/api/v1/events/event-001/price"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eventId").value("event-001"))
                .andExpect(jsonPath("$.finalPrice").value(115.00))
                .andExpect(jsonPath("$.timeBased.weight").value(0.3333))
                .andExpect(jsonPath("$.demandCount").value(12));
    }

    @Test
    @DisplayName("GET /events/{id}/price - Unknown event returns 404")
    void getCurrentPrice_NotFound_Returns404() throws Exception {
        when(pricingService.getCurrentPrice("missing")).thenThrow(new ResourceNotFoundException("Event", "missing"));

        mockMvc.perform(get("/api/v1/events/missing/price"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Event with ID missing not found"));
    }

    @Test
    @DisplayName("GET /events/{id}/availability - Returns remaining tickets and flags")
    void getAvailability_Returns200() throws Exception {
        when(eventService.getAvailability("event-001")).thenReturn(new EventAvailability(
                "event-001", 300, 100, 200, false, new BigDecimal("33.33"),
                new BigDecimal("110.00"), true, Instant.parse("2027-01-01T20:00:00Z")));

        mockMvc.perform(get("/api/v1/events/event-001/availability"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCapacity").value(300))
                .andExpect(jsonPath("$.availableTickets").value(200))
                .andExpect(jsonPath("$.isSoldOut").value(false))
                .andExpect(jsonPath("$.isActive").value(true))
                .andExpect(jsonPath("$.availabilityPercentage").value(33.33));
    }

    // ========================================
    // Admin Event Tests
    // ========================================

    @Test
    @DisplayName("GET /events - Lists upcoming events")
    void getUpcomingEvents_Returns200() throws Exception {
        List<Event> events = Arrays.asList(
                TestDataBuilder.event().eventId("event-001").name("Opening Night").build(),
                TestDataBuilder.event().eventId("event-002").capacity(40).bookedTickets(10).build());
        when(eventService.getUpcomingEvents()).thenReturn(events);

        mockMvc.perform(get("/api/v1/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name").value("Opening Night"))
                .andExpect(jsonPath("$[1].availableTickets").value(30));
    }

    @Test
    @DisplayName("POST /events - Valid request returns 201 Created")
    void createEvent_ValidRequest_Returns201() throws Exception {
        // Given
        String requestBody = """
                {
                    "name": "Summer Festival",
                    "venue": "Riverside Park",
                    "eventDate": "2027-07-01T18:00:00Z",
                    "capacity": 500,
                    "basePrice": 80.00,
                    "floorPrice": 60.00,
                    "ceilingPrice": 200.00
                }
                """;
        when(eventService.createEvent(any(Event.class))).thenAnswer(inv -> {
            Event draft = inv.getArgument(0);
            draft.setEventId("event-new");
            draft.setBookedTickets(0);
            draft.setCurrentPrice(draft.getBasePrice());
            return draft;
        });

        // When / Then
        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventId").value("event-new"))
                .andExpect(jsonPath("$.currentPrice").value(80.00))
                .andExpect(jsonPath("$.availableTickets").value(500));

        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(eventService).createEvent(captor.capture());
        assertThat(captor.getValue().getName()).isEqualTo("Summer Festival");
        assertThat(captor.getValue().getPricingRules()).isNull();
    }

    @Test
    @DisplayName("POST /events - Missing capacity returns 400 Bad Request")
    void createEvent_MissingCapacity_Returns400() throws Exception {
        String requestBody = """
                {
                    "name": "Summer Festival",
                    "venue": "Riverside Park",
                    "eventDate": "2027-07-01T18:00:00Z",
                    "basePrice": 80.00,
                    "floorPrice": 60.00,
                    "ceilingPrice": 200.00
                }
                """;

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.capacity").value("Capacity is required"));

        verify(eventService, never()).createEvent(any());
    }

    @Test
    @DisplayName("POST /events - Price ordering error returns 400 with the field")
    void createEvent_InvalidPrices_Returns400() throws Exception {
        String requestBody = """
                {
                    "name": "Summer Festival",
                    "venue": "Riverside Park",
                    "eventDate": "2027-07-01T18:00:00Z",
                    "capacity": 500,
                    "basePrice": 80.00,
                    "floorPrice": 90.00,
                    "ceilingPrice": 200.00
                }
                """;
        when(eventService.createEvent(any(Event.class)))
                .thenThrow(new InvalidEventException("floorPrice", "Floor price must not exceed base price"));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Event"))
                .andExpect(jsonPath("$.details.field").value("floorPrice"));
    }

    @Test
    @DisplayName("POST /events - Invalid pricing rules return 400")
    void createEvent_InvalidRules_Returns400() throws Exception {
        String requestBody = """
                {
                    "name": "Summer Festival",
                    "venue": "Riverside Park",
                    "eventDate": "2027-07-01T18:00:00Z",
                    "capacity": 500,
                    "basePrice": 80.00,
                    "floorPrice": 60.00,
                    "ceilingPrice": 200.00,
                    "pricingRules": {
                        "timeBased": {"weight": 0.5, "adjustmentRate": 0.1},
                        "demandBased": {"weight": 0.5, "adjustmentRate": 0.1},
                        "inventoryBased": {"weight": 0.5, "adjustmentRate": 0.1}
                    }
                }
                """;
        when(eventService.createEvent(any(Event.class)))
                .thenThrow(new InvalidPricingRulesException("Pricing rule weights must sum to 1.0, got 1.5"));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("must sum to 1.0")));
    }

    // ========================================
    // Re-pricing and Cache Tests
    // ========================================

    @Test
    @DisplayName("PATCH /events/{id}/price - Returns the refreshed breakdown")
    void refreshPrice_Returns200() throws Exception {
        when(pricingService.refreshPrice("event-001")).thenReturn(PriceBreakdown.builder()
                .eventId("event-001")
                .finalPrice(new BigDecimal("130.00"))
                .build());

        mockMvc.perform(patch("/api/v1/events/event-001/price"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalPrice").value(130.00));
    }

    @Test
    @DisplayName("POST /events/prices/refresh - Returns the refresh summary")
    void refreshAllPrices_Returns200() throws Exception {
        when(pricingService.refreshAllPrices(null))
                .thenReturn(new PriceRefreshSummary(3, 2, List.of("event-003")));

        mockMvc.perform(post("/api/v1/events/prices/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.refreshed").value(2))
                .andExpect(jsonPath("$.failedEventIds[0]").value("event-003"));
    }

    @Test
    @DisplayName("POST /events/cache/clear - Reports the number of keys removed")
    void clearCache_Returns200() throws Exception {
        when(eventService.clearCache()).thenReturn(14L);

        mockMvc.perform(post("/api/v1/events/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Cache cleared successfully"))
                .andExpect(jsonPath("$.keysRemoved").value(14));
    }
}
