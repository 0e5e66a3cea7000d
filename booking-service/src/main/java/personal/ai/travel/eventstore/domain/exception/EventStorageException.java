package personal.ai.travel.eventstore.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Event Storage Exception
 * append 영속화 실패. 배치 전체가 롤백되므로 커맨드 전체를 다시 시도해도 안전하다
 */
public class EventStorageException extends BusinessException {
    public EventStorageException(String aggregateId, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR,
                String.format("Failed to persist events: aggregateId=%s", aggregateId), cause);
    }
}
