package personal.ai.travel.booking.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.domain.model.BookingStatus;

/**
 * Invalid State Transition Exception
 * 현재 상태에서 허용되지 않는 변경 (예: 취소된 예약의 재취소)
 */
public class InvalidStateTransitionException extends BusinessException {
    public InvalidStateTransitionException(String bookingId, BookingStatus status, String action) {
        super(ErrorCode.INVALID_STATE_TRANSITION,
                String.format("Cannot %s booking in %s status: bookingId=%s", action, status, bookingId));
    }
}
