package personal.ai.travel.booking.domain.model;

/**
 * 예약 상태
 * CANCELLED는 종료 상태
 */
public enum BookingStatus {
    CONFIRMED,
    CANCELLED
}
