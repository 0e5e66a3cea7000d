package personal.ai.travel.booking.application.port.in;

import personal.ai.travel.booking.domain.model.Booking;

import java.util.List;

/**
 * Get Booking UseCase (Input Port)
 * 조회 모델만 읽는 예약 조회
 */
public interface GetBookingUseCase {

    /**
     * @throws personal.ai.travel.booking.domain.exception.BookingNotFoundException 예약이 없을 때
     */
    Booking getBooking(String bookingId);

    /**
     * 사용자 예약 목록 (최신순)
     */
    List<Booking> getUserBookings(Long userId);
}
