package personal.ai.travel.booking.domain.model;

import java.math.BigDecimal;

/**
 * 예약 취소 이벤트 (종료 이벤트)
 */
public record BookingCancelled(
        String reason,
        BigDecimal refundAmount) implements BookingEvent {

    @Override
    public BookingEventType type() {
        return BookingEventType.BOOKING_CANCELLED;
    }
}
