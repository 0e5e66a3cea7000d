package personal.ai.travel.booking.application.port.in;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.domain.model.BookingType;

import java.time.LocalDate;

/**
 * Create Booking Command
 * 예약 생성 커맨드 (형식 검증만 수행, 과거 날짜/상품 검증은 핸들러에서)
 */
public record CreateBookingCommand(
        String commandId,
        Long userId,
        BookingType bookingType,
        String offerId,
        String departure,
        String destination,
        LocalDate departDate,
        LocalDate returnDate,
        String hotelName,
        int passengers
) implements BookingCommand {

    public static final int MIN_PASSENGERS = 1;
    public static final int MAX_PASSENGERS = 9;

    public CreateBookingCommand {
        if (commandId != null && (commandId.isBlank() || commandId.length() > MAX_COMMAND_ID_LENGTH)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Command ID must be 1-64 characters when present");
        }
        if (bookingType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking type cannot be null");
        }
        if (offerId == null || offerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Offer ID cannot be null or blank");
        }
        if (departure == null || departure.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure cannot be null or blank");
        }
        if (destination == null || destination.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Destination cannot be null or blank");
        }
        if (departDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure date cannot be null");
        }
        if (returnDate != null && !returnDate.isAfter(departDate)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Return date must be after departure date");
        }
        if (bookingType.requiresHotel() && (hotelName == null || hotelName.isBlank())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Hotel name is required for " + bookingType);
        }
        if (passengers < MIN_PASSENGERS || passengers > MAX_PASSENGERS) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Passengers must be between %d and %d", MIN_PASSENGERS, MAX_PASSENGERS));
        }
    }

    @Override
    public CommandKind kind() {
        return CommandKind.BOOK;
    }
}
