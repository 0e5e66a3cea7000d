package personal.ai.travel.booking.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.travel.booking.domain.exception.ProjectionException;
import personal.ai.travel.booking.domain.exception.UnknownEventTypeException;
import personal.ai.travel.booking.domain.model.BookingCancelled;
import personal.ai.travel.booking.domain.model.BookingConfirmed;
import personal.ai.travel.booking.domain.model.BookingEventEnvelope;
import personal.ai.travel.booking.domain.model.BookingEventType;
import personal.ai.travel.booking.domain.model.BookingType;
import personal.ai.travel.eventstore.domain.model.EventDraft;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JacksonBookingEventCodec 단위 테스트")
class JacksonBookingEventCodecTest {

    private final JacksonBookingEventCodec codec = new JacksonBookingEventCodec(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));

    private static StoredEvent stored(String eventType, int schemaVersion, String payload) {
        return new StoredEvent(1L, "evt-1", "agg-1", eventType, 1L,
                Instant.parse("2026-10-01T10:00:00Z"), schemaVersion, payload, "cmd-1");
    }

    @Test
    @DisplayName("생성 이벤트는 타입 태그와 스키마 버전, commandId를 담아 인코딩된다")
    void encode_Confirmed() {
        // given
        BookingConfirmed event = new BookingConfirmed("bk-1", BookingType.HOTEL, "OFR-1", 3L, "TLV", "PAR",
                LocalDate.of(2026, 12, 1), null, "Hotel Lutetia", 2, new BigDecimal("250.00"), "EUR");

        // when
        EventDraft draft = codec.encode(event, "cmd-1");

        // then
        assertThat(draft.eventType()).isEqualTo("BookingConfirmed");
        assertThat(draft.schemaVersion()).isEqualTo(BookingEventType.CURRENT_SCHEMA_VERSION);
        assertThat(draft.commandId()).isEqualTo("cmd-1");
        assertThat(draft.payload()).contains("\"departDate\":\"2026-12-01\"").contains("Hotel Lutetia");
    }

    @Test
    @DisplayName("저장된 payload는 eventType에 맞는 이벤트와 메타데이터로 복원된다")
    void decode_Cancelled() {
        // given
        StoredEvent stored = stored("BookingCancelled", 1, "{\"reason\":\"sick\",\"refundAmount\":125.50}");

        // when
        BookingEventEnvelope envelope = codec.decode(stored);

        // then
        assertThat(envelope.type()).isEqualTo(BookingEventType.BOOKING_CANCELLED);
        assertThat(envelope.event()).isEqualTo(new BookingCancelled("sick", new BigDecimal("125.50")));
        assertThat(envelope.eventId()).isEqualTo("evt-1");
        assertThat(envelope.commandId()).isEqualTo("cmd-1");
    }

    @Test
    @DisplayName("등록되지 않은 이벤트 타입은 UnknownEventTypeException")
    void decode_UnknownType() {
        assertThatThrownBy(() -> codec.decode(stored("BookingTeleported", 1, "{}")))
                .isInstanceOf(UnknownEventTypeException.class)
                .hasMessageContaining("BookingTeleported");
    }

    @Test
    @DisplayName("지원하지 않는 스키마 버전은 ProjectionException")
    void decode_FutureSchemaVersion() {
        assertThatThrownBy(() -> codec.decode(stored("BookingCancelled", 2, "{\"reason\":null}")))
                .isInstanceOf(ProjectionException.class)
                .hasMessageContaining("schema version");
    }

    @Test
    @DisplayName("깨진 payload는 ProjectionException")
    void decode_MalformedPayload() {
        assertThatThrownBy(() -> codec.decode(stored("BookingCancelled", 1, "{not json")))
                .isInstanceOf(ProjectionException.class);
    }
}
