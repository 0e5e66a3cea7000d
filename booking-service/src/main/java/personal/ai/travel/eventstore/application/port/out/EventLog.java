package personal.ai.travel.eventstore.application.port.out;

import personal.ai.travel.eventstore.domain.model.EventDraft;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.util.List;

/**
 * Event Log (Output Port)
 * append-only 이벤트 저장소. 상태 변경의 유일한 원천
 */
public interface EventLog {

    /**
     * 이벤트 일괄 append (all-or-nothing)
     *
     * @param aggregateId     스트림 식별자
     * @param expectedVersion 호출자가 알고 있는 현재 버전 (새 스트림은 0)
     * @param drafts          순서가 보장된 이벤트 초안 목록
     * @return expectedVersion + 1 부터 연속 버전이 부여된 이벤트 목록
     * @throws personal.ai.travel.eventstore.domain.exception.ConcurrencyConflictException 저장된 버전이 다를 때
     * @throws personal.ai.travel.eventstore.domain.exception.EventStorageException 영속화 실패 시 (아무것도 저장되지 않음)
     */
    List<StoredEvent> append(String aggregateId, long expectedVersion, List<EventDraft> drafts);

    /**
     * 스트림 조회 (버전 오름차순, 없으면 빈 목록)
     */
    List<StoredEvent> read(String aggregateId, long fromVersion);

    default List<StoredEvent> read(String aggregateId) {
        return read(aggregateId, 1);
    }

    /**
     * 전체 스트림 조회 (global offset 오름차순, fromGlobalOffset 포함)
     */
    List<StoredEvent> readAll(long fromGlobalOffset, int limit);

    default List<StoredEvent> readAll(long fromGlobalOffset) {
        return readAll(fromGlobalOffset, Integer.MAX_VALUE);
    }

    /**
     * 현재 스트림 버전 (이벤트가 없으면 0)
     */
    long currentVersion(String aggregateId);

    long count();

    /**
     * 이벤트가 존재하는 모든 aggregate ID (최초 append 순)
     */
    List<String> aggregateIds();
}
