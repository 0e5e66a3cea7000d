package personal.ai.travel.booking.application.port.out;

import personal.ai.travel.booking.domain.model.BookingEvent;
import personal.ai.travel.booking.domain.model.BookingEventEnvelope;
import personal.ai.travel.eventstore.domain.model.EventDraft;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

/**
 * Booking Event Codec (Output Port)
 * 도메인 이벤트와 이벤트 로그 레코드 사이의 변환
 */
public interface BookingEventCodec {

    /**
     * 도메인 이벤트를 append 가능한 초안으로 변환
     */
    EventDraft encode(BookingEvent event, String commandId);

    /**
     * 저장된 이벤트 복원
     *
     * @throws personal.ai.travel.booking.domain.exception.UnknownEventTypeException 등록되지 않은 타입
     * @throws personal.ai.travel.booking.domain.exception.ProjectionException payload 해석 실패
     */
    BookingEventEnvelope decode(StoredEvent event);
}
