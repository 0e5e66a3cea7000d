package personal.ai.travel.booking.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Projection Exception
 * 이벤트를 조회 모델에 반영하지 못한 경우. 이벤트 자체는 이미 영속화되어 있으므로 재생(rebuild)으로 복구한다
 */
public class ProjectionException extends BusinessException {

    public ProjectionException(String aggregateId, long version, String reason) {
        super(ErrorCode.PROJECTION_FAILURE,
                String.format("Projection failed: aggregateId=%s, version=%d, reason=%s", aggregateId, version, reason));
    }

    public ProjectionException(String aggregateId, long version, Throwable cause) {
        super(ErrorCode.PROJECTION_FAILURE,
                String.format("Projection failed: aggregateId=%s, version=%d, reason=%s",
                        aggregateId, version, cause.getMessage()),
                cause);
    }

    protected ProjectionException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
