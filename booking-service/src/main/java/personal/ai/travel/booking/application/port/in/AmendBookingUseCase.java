package personal.ai.travel.booking.application.port.in;

/**
 * Amend Booking UseCase (Input Port)
 * 예약 변경 유스케이스 (날짜/인원 변경, 제공자 재검증 및 재가격)
 */
public interface AmendBookingUseCase {

    BookingCommandResult amend(AmendBookingCommand command);
}
