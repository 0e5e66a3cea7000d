package personal.ai.travel.booking.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 예약 확정 이벤트 (스트림 생성 이벤트, version 1)
 */
public record BookingConfirmed(
        String bookingId,
        BookingType bookingType,
        String offerId,
        Long userId,
        String departure,
        String destination,
        LocalDate departDate,
        LocalDate returnDate,
        String hotelName,
        int passengers,
        BigDecimal price,
        String currency) implements BookingEvent {

    @Override
    public BookingEventType type() {
        return BookingEventType.BOOKING_CONFIRMED;
    }
}
