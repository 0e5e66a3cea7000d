package personal.ai.travel.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.ai.travel.booking.application.port.in.CancelBookingCommand;

/**
 * 예약 취소 요청 DTO
 */
public record CancelBookingRequest(
        @Positive(message = "기대 버전은 1 이상이어야 합니다.")
        Long expectedVersion,

        @Size(max = 255, message = "취소 사유는 255자 이하여야 합니다.")
        String reason
) {
    public CancelBookingCommand toCommand(String commandId, String bookingId) {
        return new CancelBookingCommand(commandId, bookingId, expectedVersion, reason);
    }
}
