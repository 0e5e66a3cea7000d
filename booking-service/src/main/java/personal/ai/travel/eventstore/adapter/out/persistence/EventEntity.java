package personal.ai.travel.eventstore.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.travel.eventstore.domain.model.EventDraft;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.time.Instant;

/**
 * Event JPA Entity
 * 이벤트 로그 테이블 매핑 (insert only)
 * (aggregate_id, version) Unique Index가 동시 append의 최종 방어선
 * global_offset은 IDENTITY가 아니라 event_log_head 잠금 아래에서 부여된다 (커밋 순서와 일치)
 */
@Entity
@Table(name = "booking_events",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_event_aggregate_version", columnNames = {"aggregate_id", "version"}),
                @UniqueConstraint(name = "uk_event_event_id", columnNames = {"event_id"}),
                @UniqueConstraint(name = "uk_event_global_offset", columnNames = {"global_offset"})
        },
        indexes = @Index(name = "idx_event_command_id", columnList = "command_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "global_offset", nullable = false, updatable = false)
    private long globalOffset;

    @Column(name = "event_id", nullable = false, length = 36, updatable = false)
    private String eventId;

    @Column(name = "aggregate_id", nullable = false, length = 64, updatable = false)
    private String aggregateId;

    @Column(name = "event_type", nullable = false, length = 64, updatable = false)
    private String eventType;

    @Column(nullable = false, updatable = false)
    private long version;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "schema_version", nullable = false, updatable = false)
    private int schemaVersion;

    @Column(nullable = false, length = 4000, updatable = false)
    private String payload;

    @Column(name = "command_id", length = 64, updatable = false)
    private String commandId;

    /**
     * 초안으로부터 엔티티 생성 (offset/버전/식별자/시각은 어댑터가 부여)
     */
    public static EventEntity of(long globalOffset, String eventId, String aggregateId, long version,
                                 Instant occurredAt, EventDraft draft) {
        EventEntity entity = new EventEntity();
        entity.globalOffset = globalOffset;
        entity.eventId = eventId;
        entity.aggregateId = aggregateId;
        entity.eventType = draft.eventType();
        entity.version = version;
        entity.occurredAt = occurredAt;
        entity.schemaVersion = draft.schemaVersion();
        entity.payload = draft.payload();
        entity.commandId = draft.commandId();
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public StoredEvent toDomain() {
        return new StoredEvent(globalOffset, eventId, aggregateId, eventType, version,
                occurredAt, schemaVersion, payload, commandId);
    }
}
