package personal.ai.travel.booking.adapter.in.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import personal.ai.travel.booking.application.port.in.CommandKind;

/**
 * 범용 커맨드 요청 DTO
 *
 * @param kind      BOOK / AMEND / CANCEL
 * @param bookingId AMEND, CANCEL 대상 예약
 * @param payload   kind별 요청 본문 (CreateBookingRequest, AmendBookingRequest, CancelBookingRequest)
 */
public record SubmitCommandRequest(
        @NotNull(message = "커맨드 종류는 필수입니다.")
        CommandKind kind,

        String commandId,

        Long userId,

        String bookingId,

        @NotNull(message = "커맨드 본문은 필수입니다.")
        JsonNode payload
) {
}
