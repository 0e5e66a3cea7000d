package personal.ai.travel.booking.application.port.in;

/**
 * Submit Booking Command UseCase (Input Port)
 * 커맨드 단일 진입점: kind에 따라 해당 핸들러로 위임
 */
public interface SubmitBookingCommandUseCase {

    BookingCommandResult submit(BookingCommand command);
}
