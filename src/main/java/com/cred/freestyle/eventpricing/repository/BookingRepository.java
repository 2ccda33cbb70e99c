package com.cred.freestyle.eventpricing.repository;

import com.cred.freestyle.eventpricing.domain.model.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Repository interface for Booking entity.
 *
 * @author Event Pricing Team
 */
@Repository
public interface BookingRepository extends JpaRepository<Booking, String> {

    /**
     * Count bookings for an event created at or after a given instant.
     * This is the demand signal of the price model.
     *
     * @param eventId Event ID
     * @param since Start of the demand window
     * @return Number of bookings in the window
     */
    long countByEventIdAndCreatedAtGreaterThanEqual(String eventId, Instant since);

    List<Booking> findByEventIdOrderByCreatedAtDesc(String eventId);

    List<Booking> findByCustomerEmailOrderByCreatedAtDesc(String customerEmail);

    long countByEventId(String eventId);

    /**
     * Total tickets held by bookings of an event.
     *
     * @param eventId Event ID
     * @return Sum of ticket counts, or null if the event has no bookings
     */
    @Query("SELECT SUM(b.ticketCount) FROM Booking b WHERE b.eventId = :eventId")
    Long sumTicketCountByEventId(@Param("eventId") String eventId);

    /**
     * Total amount charged for bookings of an event.
     *
     * @param eventId Event ID
     * @return Sum of total amounts, or null if the event has no bookings
     */
    @Query("SELECT SUM(b.totalAmount) FROM Booking b WHERE b.eventId = :eventId")
    BigDecimal sumTotalAmountByEventId(@Param("eventId") String eventId);
}
