package personal.ai.travel.eventstore.domain.model;

import java.time.Instant;

/**
 * Stored Event Domain Model
 * 이벤트 로그에 영속화된 불변 이벤트
 *
 * @param globalOffset 전체 스트림 기준 append 위치 (단조 증가)
 * @param eventId      이벤트 고유 ID (재사용되지 않음)
 * @param aggregateId  스트림 식별자
 * @param version      aggregate 내 순번 (1부터, 빈틈 없음)
 */
public record StoredEvent(
        long globalOffset,
        String eventId,
        String aggregateId,
        String eventType,
        long version,
        Instant timestamp,
        int schemaVersion,
        String payload,
        String commandId) {

    public boolean producedBy(String candidateCommandId) {
        return commandId != null && commandId.equals(candidateCommandId);
    }
}
