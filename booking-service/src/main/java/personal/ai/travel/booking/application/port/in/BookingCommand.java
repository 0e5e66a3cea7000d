package personal.ai.travel.booking.application.port.in;

/**
 * Booking Command (sealed)
 * 하나의 커맨드는 하나의 aggregate만 변경한다
 */
public sealed interface BookingCommand permits CreateBookingCommand, AmendBookingCommand, CancelBookingCommand {

    int MAX_COMMAND_ID_LENGTH = 64;

    CommandKind kind();

    /**
     * 멱등 키 (선택). 같은 키로 재전송된 커맨드는 기존 결과로 수렴한다
     */
    String commandId();
}
