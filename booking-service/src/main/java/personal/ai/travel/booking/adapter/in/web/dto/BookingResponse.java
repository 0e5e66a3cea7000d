package personal.ai.travel.booking.adapter.in.web.dto;

import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingStatus;
import personal.ai.travel.booking.domain.model.BookingType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 예약 응답 DTO
 */
public record BookingResponse(
        String bookingId,
        String aggregateId,
        Long userId,
        BookingType bookingType,
        String offerId,
        String departure,
        String destination,
        LocalDate departDate,
        LocalDate returnDate,
        String hotelName,
        int passengers,
        BigDecimal price,
        String currency,
        BookingStatus status,
        String cancellationReason,
        BigDecimal refundAmount,
        Instant createdAt,
        Instant updatedAt,
        String lastEventId,
        long lastVersion
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.bookingId(),
                booking.aggregateId(),
                booking.userId(),
                booking.bookingType(),
                booking.offerId(),
                booking.departure(),
                booking.destination(),
                booking.departDate(),
                booking.returnDate(),
                booking.hotelName(),
                booking.passengers(),
                booking.price(),
                booking.currency(),
                booking.status(),
                booking.cancellationReason(),
                booking.refundAmount(),
                booking.createdAt(),
                booking.updatedAt(),
                booking.lastEventId(),
                booking.lastVersion()
        );
    }
}
