package personal.ai.travel.eventstore.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Event Draft
 * append 전의 이벤트 (버전/식별자/타임스탬프는 이벤트 로그가 부여)
 *
 * @param eventType     이벤트 타입 태그
 * @param schemaVersion payload 스키마 버전
 * @param payload       JSON 문서
 * @param commandId     이벤트를 만든 커맨드의 멱등 키 (선택)
 */
public record EventDraft(
        String eventType,
        int schemaVersion,
        String payload,
        String commandId) {
    public EventDraft {
        if (eventType == null || eventType.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event type cannot be null or blank");
        }
        if (schemaVersion < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Schema version must be positive");
        }
        if (payload == null || payload.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event payload cannot be null or blank");
        }
    }
}
