package personal.ai.travel.booking.domain.exception;

import personal.ai.common.exception.ErrorCode;

/**
 * Unknown Event Type Exception
 * 등록되지 않은 이벤트 타입. 해당 aggregate의 반영만 중단된다
 */
public class UnknownEventTypeException extends ProjectionException {
    public UnknownEventTypeException(String eventType) {
        super(ErrorCode.UNKNOWN_EVENT_TYPE,
                String.format("Unknown event type: eventType=%s", eventType));
    }
}
