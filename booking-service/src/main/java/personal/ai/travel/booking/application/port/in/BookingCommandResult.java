package personal.ai.travel.booking.application.port.in;

import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

/**
 * 커맨드 처리 결과
 *
 * @param outcome     완전 성공 / 부분 성공 구분
 * @param bookingId   예약 ID
 * @param aggregateId 스트림 ID
 * @param eventId     영속화된 마지막 이벤트 ID
 * @param version     영속화된 마지막 이벤트 버전
 * @param booking     반영된 행 (PROJECTION_PENDING이면 null)
 * @param detail      반영 실패 상세 (COMPLETED면 null)
 */
public record BookingCommandResult(
        CommandOutcome outcome,
        String bookingId,
        String aggregateId,
        String eventId,
        long version,
        Booking booking,
        String detail
) {
    public static BookingCommandResult completed(StoredEvent event, Booking booking) {
        return new BookingCommandResult(CommandOutcome.COMPLETED, booking.bookingId(), event.aggregateId(),
                event.eventId(), event.version(), booking, null);
    }

    public static BookingCommandResult projectionPending(String bookingId, StoredEvent event, String detail) {
        return new BookingCommandResult(CommandOutcome.PROJECTION_PENDING, bookingId, event.aggregateId(),
                event.eventId(), event.version(), null, detail);
    }

    public boolean isCompleted() {
        return outcome == CommandOutcome.COMPLETED;
    }
}
