package personal.ai.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Booking Domain (3xxx)
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    OFFER_UNAVAILABLE(HttpStatus.CONFLICT, "B002", "예약 가능한 상품이 아닙니다."),
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT, "B003", "현재 예약 상태에서 허용되지 않는 요청입니다."),
    CONCURRENCY_CONFLICT(HttpStatus.CONFLICT, "B004", "동시 요청 충돌이 발생했습니다. 최신 상태로 다시 시도해주세요."),
    STORAGE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "B005", "이벤트 저장에 실패했습니다."),
    PROJECTION_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "B006", "조회 모델 반영에 실패했습니다."),
    AGGREGATE_NOT_FOUND(HttpStatus.NOT_FOUND, "B007", "이벤트 스트림을 찾을 수 없습니다."),
    UNKNOWN_EVENT_TYPE(HttpStatus.INTERNAL_SERVER_ERROR, "B008", "알 수 없는 이벤트 타입입니다."),

    // External Service (6xxx)
    PROVIDER_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "외부 상품 제공자 오류가 발생했습니다."),
    PROVIDER_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "E002", "외부 상품 제공자 응답 시간 초과입니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
