package personal.ai.travel.booking.application.port.in;

/**
 * Cancel Booking UseCase (Input Port)
 * 예약 취소 유스케이스
 */
public interface CancelBookingUseCase {

    /**
     * 예약 취소 (CONFIRMED → CANCELLED)
     *
     * @throws personal.ai.travel.booking.domain.exception.BookingNotFoundException 예약이 없을 때
     * @throws personal.ai.travel.booking.domain.exception.InvalidStateTransitionException 이미 취소된 예약일 때
     * @throws personal.ai.travel.eventstore.domain.exception.ConcurrencyConflictException 동시 변경에 밀렸을 때
     */
    BookingCommandResult cancel(CancelBookingCommand command);
}
