package personal.ai.travel.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import personal.ai.travel.booking.application.port.in.AmendBookingCommand;

import java.time.LocalDate;

/**
 * 예약 변경 요청 DTO (비어 있는 필드는 기존 값 유지)
 */
public record AmendBookingRequest(
        @Positive(message = "기대 버전은 1 이상이어야 합니다.")
        Long expectedVersion,

        LocalDate departDate,

        LocalDate returnDate,

        @Min(value = 1, message = "인원은 1명 이상이어야 합니다.")
        @Max(value = 9, message = "인원은 9명 이하여야 합니다.")
        Integer passengers
) {
    public AmendBookingCommand toCommand(String commandId, String bookingId) {
        return new AmendBookingCommand(commandId, bookingId, expectedVersion, departDate, returnDate, passengers);
    }
}
