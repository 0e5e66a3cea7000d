package personal.ai.travel.booking.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Booking Not Found Exception
 * 조회 모델에 예약이 없을 때 발생하는 예외
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(String bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND,
                String.format("Booking not found: bookingId=%s", bookingId));
    }
}
