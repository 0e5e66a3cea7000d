package personal.ai.travel.eventstore.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Aggregate Not Found Exception
 * 이벤트가 하나도 없는 스트림을 재생하려 할 때 발생
 */
public class AggregateNotFoundException extends BusinessException {
    public AggregateNotFoundException(String aggregateId) {
        super(ErrorCode.AGGREGATE_NOT_FOUND,
                String.format("No events found: aggregateId=%s", aggregateId));
    }
}
