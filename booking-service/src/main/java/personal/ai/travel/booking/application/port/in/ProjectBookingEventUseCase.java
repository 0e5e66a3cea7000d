package personal.ai.travel.booking.application.port.in;

import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

/**
 * Project Booking Event UseCase (Input Port)
 * Projection Engine: 이벤트를 조회 모델에 반영
 */
public interface ProjectBookingEventUseCase {

    /**
     * 이벤트 하나 반영 (멱등: 이미 반영된 버전은 무시)
     *
     * @throws personal.ai.travel.booking.domain.exception.UnknownEventTypeException 등록되지 않은 타입
     * @throws personal.ai.travel.booking.domain.exception.ProjectionException 반영 불가
     */
    Booking apply(StoredEvent event);

    /**
     * 기존 행을 버리고 스트림 전체를 다시 접어 행 재구성
     *
     * @throws personal.ai.travel.eventstore.domain.exception.AggregateNotFoundException 이벤트가 없을 때
     */
    Booking rebuild(String aggregateId);
}
