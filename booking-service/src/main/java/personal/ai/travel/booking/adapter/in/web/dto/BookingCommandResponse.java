package personal.ai.travel.booking.adapter.in.web.dto;

import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CommandOutcome;

/**
 * 커맨드 처리 응답 DTO
 * PROJECTION_PENDING이면 booking은 null, detail에 반영 실패 원인
 */
public record BookingCommandResponse(
        CommandOutcome outcome,
        String bookingId,
        String aggregateId,
        String eventId,
        long version,
        BookingResponse booking,
        String detail
) {
    public static BookingCommandResponse from(BookingCommandResult result) {
        return new BookingCommandResponse(
                result.outcome(),
                result.bookingId(),
                result.aggregateId(),
                result.eventId(),
                result.version(),
                result.booking() != null ? BookingResponse.from(result.booking()) : null,
                result.detail()
        );
    }
}
