package personal.ai.travel.booking.domain.model;

import java.time.Instant;

/**
 * 디코딩된 이벤트 + 이벤트 로그 메타데이터
 */
public record BookingEventEnvelope(
        String eventId,
        String aggregateId,
        long version,
        Instant timestamp,
        String commandId,
        BookingEvent event) {

    public BookingEventType type() {
        return event.type();
    }
}
