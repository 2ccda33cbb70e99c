package com.cred.freestyle.eventpricing.domain.booking;

import com.cred.freestyle.eventpricing.domain.model.Booking.BookingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of a committed cancellation.
 *
 * @author Event Pricing Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationReceipt {

    private String bookingId;
    private String eventId;
    private Integer ticketsReleased;

    /**
     * Amount originally charged for the booking.
     */
    private BigDecimal refundAmount;

    /**
     * Event price recomputed after the tickets were returned.
     */
    private BigDecimal newPrice;

    private BookingStatus status;
    private String message;
}
