package personal.ai.travel.eventstore.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Concurrency Conflict Exception
 * 저장된 버전이 기대 버전과 다르거나, 같은 버전을 동시에 append 하려다 Unique Index에서 밀린 경우
 * 호출자는 최신 상태를 다시 읽고 재시도해야 한다
 */
public class ConcurrencyConflictException extends BusinessException {

    private final String aggregateId;
    private final long expectedVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super(ErrorCode.CONCURRENCY_CONFLICT,
                String.format("Version conflict: aggregateId=%s, expectedVersion=%d, actualVersion=%d",
                        aggregateId, expectedVersion, actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, Throwable cause) {
        super(ErrorCode.CONCURRENCY_CONFLICT,
                String.format("Concurrent append detected: aggregateId=%s, expectedVersion=%d",
                        aggregateId, expectedVersion),
                cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
