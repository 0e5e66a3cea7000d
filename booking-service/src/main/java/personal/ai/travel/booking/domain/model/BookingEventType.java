package personal.ai.travel.booking.domain.model;

import personal.ai.travel.booking.domain.exception.UnknownEventTypeException;

/**
 * 예약 이벤트 타입 (닫힌 집합)
 * 새 타입 추가 시 BookingProjector의 switch가 컴파일 단계에서 누락을 드러낸다
 */
public enum BookingEventType {
    BOOKING_CONFIRMED("BookingConfirmed", BookingConfirmed.class),
    BOOKING_AMENDED("BookingAmended", BookingAmended.class),
    BOOKING_CANCELLED("BookingCancelled", BookingCancelled.class);

    /** 현재 모든 이벤트 payload의 스키마 버전 */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    private final String eventName;
    private final Class<? extends BookingEvent> payloadType;

    BookingEventType(String eventName, Class<? extends BookingEvent> payloadType) {
        this.eventName = eventName;
        this.payloadType = payloadType;
    }

    /**
     * 저장된 태그로부터 타입 복원
     *
     * @throws UnknownEventTypeException 등록되지 않은 태그일 때
     */
    public static BookingEventType from(String eventName) {
        for (BookingEventType type : values()) {
            if (type.eventName.equals(eventName)) {
                return type;
            }
        }
        throw new UnknownEventTypeException(eventName);
    }

    public String eventName() {
        return eventName;
    }

    public Class<? extends BookingEvent> payloadType() {
        return payloadType;
    }

    public boolean isCreation() {
        return this == BOOKING_CONFIRMED;
    }
}
