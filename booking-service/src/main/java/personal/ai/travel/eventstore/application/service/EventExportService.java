package personal.ai.travel.eventstore.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.eventstore.application.port.in.EventPage;
import personal.ai.travel.eventstore.application.port.in.ExportEventsUseCase;
import personal.ai.travel.eventstore.application.port.out.EventLog;
import personal.ai.travel.eventstore.domain.exception.AggregateNotFoundException;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.util.List;

/**
 * Event Export Service
 * 단일 책임: 이벤트 로그 감사 조회
 */
@Slf4j
@Service
public class EventExportService implements ExportEventsUseCase {

    private final EventLog eventLog;
    private final int maxPageSize;

    public EventExportService(EventLog eventLog,
                              @Value("${booking.event-store.export-max-page-size:500}") int maxPageSize) {
        this.eventLog = eventLog;
        this.maxPageSize = maxPageSize;
    }

    @Override
    public EventPage exportEvents(long fromOffset, int limit) {
        if (fromOffset < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Offset cannot be negative");
        }
        if (limit < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Limit must be positive");
        }

        int pageSize = Math.min(limit, maxPageSize);
        List<StoredEvent> events = eventLog.readAll(fromOffset, pageSize);
        long nextOffset = events.isEmpty()
                ? fromOffset
                : events.get(events.size() - 1).globalOffset() + 1;

        log.debug("Events exported: fromOffset={}, size={}, nextOffset={}", fromOffset, events.size(), nextOffset);
        return new EventPage(events, nextOffset);
    }

    @Override
    public List<StoredEvent> getEventStream(String aggregateId) {
        List<StoredEvent> events = eventLog.read(aggregateId);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateId);
        }
        return events;
    }
}
