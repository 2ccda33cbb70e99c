package com.cred.freestyle.eventpricing.domain.booking;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Aggregate figures over the bookings of one event.
 *
 * @author Event Pricing Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingStats {

    private String eventId;
    private long totalBookings;
    private long totalTickets;
    private BigDecimal totalRevenue;

    /**
     * Mean tickets per booking, 2 decimals.
     */
    private BigDecimal averageTickets;
}
