package personal.ai.travel.booking.adapter.in.web.dto;

import personal.ai.travel.eventstore.application.port.in.EventPage;

import java.util.List;

/**
 * 전체 이벤트 페이지 응답 DTO (다음 요청은 nextOffset 부터)
 */
public record EventPageResponse(
        List<StoredEventResponse> events,
        long nextOffset
) {
    public static EventPageResponse from(EventPage page) {
        return new EventPageResponse(
                page.events().stream().map(StoredEventResponse::from).toList(),
                page.nextOffset()
        );
    }
}
