package personal.ai.travel.booking.adapter.in.web.dto;

import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.time.Instant;

/**
 * 이벤트 감사 조회 응답 DTO
 */
public record StoredEventResponse(
        long globalOffset,
        String eventId,
        String aggregateId,
        String eventType,
        long version,
        Instant timestamp,
        int schemaVersion,
        String payload,
        String commandId
) {
    public static StoredEventResponse from(StoredEvent event) {
        return new StoredEventResponse(
                event.globalOffset(),
                event.eventId(),
                event.aggregateId(),
                event.eventType(),
                event.version(),
                event.timestamp(),
                event.schemaVersion(),
                event.payload(),
                event.commandId()
        );
    }
}
