package personal.ai.travel.booking.application.port.in;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Amend Booking Command
 * 예약 변경 커맨드. null 필드는 기존 값 유지
 *
 * @param expectedVersion 호출자가 알고 있는 버전 (null이면 조회 모델의 lastVersion 사용)
 */
public record AmendBookingCommand(
        String commandId,
        String bookingId,
        Long expectedVersion,
        LocalDate departDate,
        LocalDate returnDate,
        Integer passengers
) implements BookingCommand {

    public AmendBookingCommand {
        if (commandId != null && (commandId.isBlank() || commandId.length() > MAX_COMMAND_ID_LENGTH)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Command ID must be 1-64 characters when present");
        }
        if (bookingId == null || bookingId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null or blank");
        }
        if (expectedVersion != null && expectedVersion < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expected version must be positive");
        }
        if (departDate == null && returnDate == null && passengers == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Nothing to amend");
        }
        if (passengers != null && (passengers < CreateBookingCommand.MIN_PASSENGERS
                || passengers > CreateBookingCommand.MAX_PASSENGERS)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Passengers must be between %d and %d",
                            CreateBookingCommand.MIN_PASSENGERS, CreateBookingCommand.MAX_PASSENGERS));
        }
    }

    @Override
    public CommandKind kind() {
        return CommandKind.AMEND;
    }
}
