package personal.ai.travel.eventstore.application.port.in;

import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.util.List;

/**
 * 전체 이벤트 스트림 페이지
 *
 * @param events     global offset 오름차순 이벤트
 * @param nextOffset 다음 페이지를 이어 읽을 offset (이벤트가 없으면 요청 offset 그대로)
 */
public record EventPage(
        List<StoredEvent> events,
        long nextOffset
) {
    public boolean isEmpty() {
        return events.isEmpty();
    }
}
