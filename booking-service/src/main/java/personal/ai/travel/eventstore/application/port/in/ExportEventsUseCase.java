package personal.ai.travel.eventstore.application.port.in;

import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.util.List;

/**
 * Export Events UseCase (Input Port)
 * 감사/재생용 이벤트 조회
 */
public interface ExportEventsUseCase {

    /**
     * 전체 스트림을 global offset 기준으로 페이지 조회
     *
     * @param fromOffset 시작 offset (포함)
     * @param limit      최대 이벤트 수 (설정된 최대 페이지 크기로 제한)
     */
    EventPage exportEvents(long fromOffset, int limit);

    /**
     * 단일 aggregate의 전체 이력 조회
     *
     * @throws personal.ai.travel.eventstore.domain.exception.AggregateNotFoundException 이벤트가 없을 때
     */
    List<StoredEvent> getEventStream(String aggregateId);
}
