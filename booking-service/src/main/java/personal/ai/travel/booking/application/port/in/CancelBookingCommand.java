package personal.ai.travel.booking.application.port.in;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Cancel Booking Command
 * 예약 취소 커맨드
 */
public record CancelBookingCommand(
        String commandId,
        String bookingId,
        Long expectedVersion,
        String reason
) implements BookingCommand {

    private static final int MAX_REASON_LENGTH = 255;

    public CancelBookingCommand {
        if (commandId != null && (commandId.isBlank() || commandId.length() > MAX_COMMAND_ID_LENGTH)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Command ID must be 1-64 characters when present");
        }
        if (bookingId == null || bookingId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null or blank");
        }
        if (expectedVersion != null && expectedVersion < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expected version must be positive");
        }
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reason must be at most 255 characters");
        }
    }

    @Override
    public CommandKind kind() {
        return CommandKind.CANCEL;
    }
}
