package com.cred.freestyle.eventpricing.api.controller;

import com.cred.freestyle.eventpricing.api.dto.BookingRequest;
import com.cred.freestyle.eventpricing.api.dto.BookingResponse;
import com.cred.freestyle.eventpricing.domain.booking.BookingStats;
import com.cred.freestyle.eventpricing.domain.booking.CancellationReceipt;
import com.cred.freestyle.eventpricing.domain.model.Booking;
import com.cred.freestyle.eventpricing.service.BookingCoordinator;
import com.cred.freestyle.eventpricing.service.BookingQueryService;
import com.cred.freestyle.eventpricing.service.CancellationCoordinator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for bookings.
 * Booking, cancellation and the booking views are public.
 *
 * @author Event Pricing Team
 */
@RestController
@RequestMapping("/api/v1/bookings")
public class BookingController {

    private static final Logger logger = LoggerFactory.getLogger(BookingController.class);

    private final BookingCoordinator bookingCoordinator;
    private final CancellationCoordinator cancellationCoordinator;
    private final BookingQueryService bookingQueryService;

    public BookingController(
            BookingCoordinator bookingCoordinator,
            CancellationCoordinator cancellationCoordinator,
            BookingQueryService bookingQueryService
    ) {
        this.bookingCoordinator = bookingCoordinator;
        this.cancellationCoordinator = cancellationCoordinator;
        this.bookingQueryService = bookingQueryService;
    }

    /**
     * Book tickets at the event's current price.
     *
     * @param request Booking request
     * @return Created booking
     */
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(@Valid @RequestBody BookingRequest request) {
        logger.info("Booking request: event {}, {} tickets", request.getEventId(), request.getTicketCount());

        Booking booking = bookingCoordinator.book(
                request.getEventId(),
                request.getTicketCount(),
                request.getCustomerEmail()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.fromEntity(booking));
    }

    /**
     * Cancel a booking. Only the email the booking was made with may cancel it.
     *
     * @param bookingId Booking ID
     * @param email Customer email
     * @return Cancellation receipt
     */
    @DeleteMapping("/{bookingId}")
    public ResponseEntity<CancellationReceipt> cancelBooking(
            @PathVariable String bookingId,
            @RequestParam String email
    ) {
        logger.info("Cancellation request for booking {}", bookingId);
        return ResponseEntity.ok(cancellationCoordinator.cancel(bookingId, email));
    }

    @GetMapping
    public ResponseEntity<List<BookingResponse>> getEventBookings(@RequestParam String eventId) {
        return ResponseEntity.ok(toResponses(bookingQueryService.getEventBookings(eventId)));
    }

    @GetMapping("/customer")
    public ResponseEntity<List<BookingResponse>> getCustomerBookings(@RequestParam String email) {
        return ResponseEntity.ok(toResponses(bookingQueryService.getCustomerBookings(email)));
    }

    @GetMapping("/stats/{eventId}")
    public ResponseEntity<BookingStats> getEventStats(@PathVariable String eventId) {
        return ResponseEntity.ok(bookingQueryService.getEventStats(eventId));
    }

    private static List<BookingResponse> toResponses(List<Booking> bookings) {
        return bookings.stream()
                .map(BookingResponse::fromEntity)
                .collect(Collectors.toList());
    }
}
