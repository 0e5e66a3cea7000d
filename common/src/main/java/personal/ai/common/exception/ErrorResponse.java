package personal.ai.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param result  항상 "error"
 * @param code    ErrorCode 코드 (예: B004)
 * @param message 사용자 메시지
 * @param detail  복구에 필요한 상세 정보 (없으면 null)
 */
public record ErrorResponse(
        String result,
        String code,
        String message,
        String detail
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse("error", errorCode.getCode(), message, null);
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, String detail) {
        return new ErrorResponse("error", errorCode.getCode(), message, detail);
    }
}
