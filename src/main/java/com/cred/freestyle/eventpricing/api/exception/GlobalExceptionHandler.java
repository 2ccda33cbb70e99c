package com.cred.freestyle.eventpricing.api.exception;

import com.cred.freestyle.eventpricing.api.dto.ErrorResponse;
import com.cred.freestyle.eventpricing.exception.BookingFailedException;
import com.cred.freestyle.eventpricing.exception.BookingValidationException;
import com.cred.freestyle.eventpricing.exception.CancellationExpiredException;
import com.cred.freestyle.eventpricing.exception.CapacityExceededException;
import com.cred.freestyle.eventpricing.exception.EventClosedException;
import com.cred.freestyle.eventpricing.exception.ForbiddenOperationException;
import com.cred.freestyle.eventpricing.exception.InvalidEventException;
import com.cred.freestyle.eventpricing.exception.InvalidPricingRulesException;
import com.cred.freestyle.eventpricing.exception.PoolBusyException;
import com.cred.freestyle.eventpricing.exception.RateLimitedException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the event pricing API.
 * Converts exceptions thrown by controllers into {@link ErrorResponse} bodies.
 *
 * @author Event Pricing Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle CapacityExceededException.
     * Returns 409 CONFLICT with the remaining ticket count.
     */
    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceededException(
            CapacityExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Capacity exceeded: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT,
                "Capacity Exceeded",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("eventId", ex.getEventId());
        error.addDetail("requestedTickets", ex.getRequestedTickets());
        error.addDetail("remainingTickets", ex.getRemainingTickets());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle PoolBusyException.
     * Returns 409 CONFLICT; nothing was written and the client may retry.
     */
    @ExceptionHandler(PoolBusyException.class)
    public ResponseEntity<ErrorResponse> handlePoolBusyException(
            PoolBusyException ex,
            HttpServletRequest request
    ) {
        logger.warn("Pool busy: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT,
                "Event Busy",
                "The event is handling other bookings. Please retry.",
                request.getRequestURI()
        );
        error.addDetail("eventId", ex.getEventId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle RateLimitedException.
     * Returns 429 TOO MANY REQUESTS with a Retry-After header.
     */
    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitedException(
            RateLimitedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Rate limited: {}", ex.getCustomerEmail());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.TOO_MANY_REQUESTS,
                "Too Many Requests",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("retryAfterSeconds", ex.getRetryAfterSeconds());

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(error);
    }

    /**
     * Handle EventClosedException.
     * Returns 410 GONE when the event no longer takes bookings.
     */
    @ExceptionHandler(EventClosedException.class)
    public ResponseEntity<ErrorResponse> handleEventClosedException(
            EventClosedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Event closed: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.GONE,
                "Event Closed",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("eventId", ex.getEventId());

        return ResponseEntity.status(HttpStatus.GONE).body(error);
    }

    /**
     * Handle CancellationExpiredException.
     * Returns 410 GONE when the event has already taken place.
     */
    @ExceptionHandler(CancellationExpiredException.class)
    public ResponseEntity<ErrorResponse> handleCancellationExpiredException(
            CancellationExpiredException ex,
            HttpServletRequest request
    ) {
        logger.warn("Cancellation expired: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.GONE,
                "Cancellation Expired",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("bookingId", ex.getBookingId());
        error.addDetail("eventId", ex.getEventId());

        return ResponseEntity.status(HttpStatus.GONE).body(error);
    }

    /**
     * Handle ForbiddenOperationException.
     * Returns 403 FORBIDDEN when a customer acts on someone else's booking.
     */
    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbiddenOperationException(
            ForbiddenOperationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Forbidden operation on booking {}: {}", ex.getBookingId(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.FORBIDDEN,
                "Forbidden",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when an event or booking doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(BookingValidationException.class)
    public ResponseEntity<ErrorResponse> handleBookingValidationException(
            BookingValidationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid booking request: {}", ex.getMessage());
        return badRequest("Invalid Request", ex.getMessage(), request, ex.getField());
    }

    @ExceptionHandler(InvalidEventException.class)
    public ResponseEntity<ErrorResponse> handleInvalidEventException(
            InvalidEventException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid event: {}", ex.getMessage());
        return badRequest("Invalid Event", ex.getMessage(), request, ex.getField());
    }

    @ExceptionHandler(InvalidPricingRulesException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPricingRulesException(
            InvalidPricingRulesException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid pricing rules: {}", ex.getMessage());
        return badRequest("Invalid Pricing Rules", ex.getMessage(), request, null);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing request parameter: {}", ex.getParameterName());
        return badRequest("Invalid Request",
                String.format("Query parameter '%s' is required", ex.getParameterName()),
                request, ex.getParameterName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("Invalid Request", "Request body is missing or malformed", request, null);
    }

    /**
     * Handle BookingFailedException.
     * Returns 500 without storage details; the transaction was rolled back.
     */
    @ExceptionHandler(BookingFailedException.class)
    public ResponseEntity<ErrorResponse> handleBookingFailedException(
            BookingFailedException ex,
            HttpServletRequest request
    ) {
        logger.error("Booking failed for event {}", ex.getEventId(), ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Booking Failed",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> badRequest(
            String title,
            String message,
            HttpServletRequest request,
            String field
    ) {
        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, title, message, request.getRequestURI());
        if (field != null) {
            error.addDetail("field", field);
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
