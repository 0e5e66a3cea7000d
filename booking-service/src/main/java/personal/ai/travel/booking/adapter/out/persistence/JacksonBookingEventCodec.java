package personal.ai.travel.booking.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.application.port.out.BookingEventCodec;
import personal.ai.travel.booking.domain.exception.ProjectionException;
import personal.ai.travel.booking.domain.model.BookingEvent;
import personal.ai.travel.booking.domain.model.BookingEventEnvelope;
import personal.ai.travel.booking.domain.model.BookingEventType;
import personal.ai.travel.eventstore.domain.model.EventDraft;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

/**
 * Jackson Booking Event Codec (Adapter Layer)
 * 이벤트 payload를 JSON 문서로 저장하고 eventType 태그로 payload 타입을 결정한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JacksonBookingEventCodec implements BookingEventCodec {

    private final ObjectMapper objectMapper;

    @Override
    public EventDraft encode(BookingEvent event, String commandId) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            return new EventDraft(
                    event.type().eventName(),
                    BookingEventType.CURRENT_SCHEMA_VERSION,
                    payload,
                    commandId);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode event: type={}", event.type(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to encode booking event", e);
        }
    }

    @Override
    public BookingEventEnvelope decode(StoredEvent event) {
        BookingEventType type = BookingEventType.from(event.eventType());
        if (event.schemaVersion() > BookingEventType.CURRENT_SCHEMA_VERSION) {
            throw new ProjectionException(event.aggregateId(), event.version(),
                    "unsupported schema version " + event.schemaVersion() + " for " + event.eventType());
        }

        try {
            BookingEvent payload = objectMapper.readValue(event.payload(), type.payloadType());
            return new BookingEventEnvelope(
                    event.eventId(),
                    event.aggregateId(),
                    event.version(),
                    event.timestamp(),
                    event.commandId(),
                    payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to decode event: eventId={}, type={}", event.eventId(), event.eventType(), e);
            throw new ProjectionException(event.aggregateId(), event.version(), e);
        }
    }
}
