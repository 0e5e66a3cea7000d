package personal.ai.travel.booking.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 예약 변경 이벤트 (변경 후 전체 값을 담는다)
 */
public record BookingAmended(
        LocalDate departDate,
        LocalDate returnDate,
        int passengers,
        BigDecimal price,
        String currency) implements BookingEvent {

    @Override
    public BookingEventType type() {
        return BookingEventType.BOOKING_AMENDED;
    }
}
