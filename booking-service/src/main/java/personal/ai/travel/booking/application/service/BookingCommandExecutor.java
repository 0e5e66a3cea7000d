package personal.ai.travel.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.ProjectBookingEventUseCase;
import personal.ai.travel.booking.application.port.out.BookingEventCodec;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingEvent;
import personal.ai.travel.eventstore.application.port.out.EventLog;
import personal.ai.travel.eventstore.domain.exception.ConcurrencyConflictException;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.util.List;
import java.util.Optional;

/**
 * Booking Command Executor
 * 커맨드 핸들러 공통 흐름: encode → append(expectedVersion) → 동기 반영
 *
 * - 검증과 append, 반영 사이에 잠금을 잡지 않는다 (동시성은 append의 버전 검사로만 제어)
 * - append 성공 후 반영 실패는 PROJECTION_PENDING 결과로 돌려준다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCommandExecutor {

    private final EventLog eventLog;
    private final BookingEventCodec bookingEventCodec;
    private final ProjectBookingEventUseCase projectBookingEventUseCase;

    /**
     * 이벤트 하나를 append 하고 조회 모델에 반영
     *
     * @throws ConcurrencyConflictException 다른 커맨드가 먼저 append 한 경우
     */
    public BookingCommandResult execute(String aggregateId, String bookingId, long expectedVersion,
                                        String commandId, BookingEvent event) {
        List<StoredEvent> appended;
        try {
            appended = eventLog.append(aggregateId, expectedVersion,
                    List.of(bookingEventCodec.encode(event, commandId)));
        } catch (ConcurrencyConflictException e) {
            return resolveConflict(aggregateId, bookingId, expectedVersion, commandId, e);
        }

        StoredEvent last = appended.get(appended.size() - 1);
        log.info("Event appended: aggregateId={}, type={}, version={}, eventId={}",
                aggregateId, last.eventType(), last.version(), last.eventId());
        return project(bookingId, appended);
    }

    /**
     * 같은 commandId로 이미 처리된 커맨드면 기존 결과를 돌려준다
     */
    public Optional<BookingCommandResult> replayIfProcessed(String aggregateId, String bookingId, String commandId) {
        if (commandId == null) {
            return Optional.empty();
        }
        List<StoredEvent> produced = eventLog.read(aggregateId).stream()
                .filter(stored -> stored.producedBy(commandId))
                .toList();
        if (produced.isEmpty()) {
            return Optional.empty();
        }

        log.info("Command already processed, returning previous outcome: aggregateId={}, commandId={}",
                aggregateId, commandId);
        return Optional.of(project(bookingId, produced));
    }

    private BookingCommandResult resolveConflict(String aggregateId, String bookingId, long expectedVersion,
                                                 String commandId, ConcurrencyConflictException conflict) {
        if (commandId == null) {
            log.warn("Append rejected by concurrent writer: aggregateId={}, expectedVersion={}",
                    aggregateId, expectedVersion);
            throw conflict;
        }

        List<StoredEvent> produced = eventLog.read(aggregateId, expectedVersion + 1).stream()
                .filter(stored -> stored.producedBy(commandId))
                .toList();
        if (produced.isEmpty()) {
            log.warn("Append rejected by concurrent writer: aggregateId={}, expectedVersion={}, commandId={}",
                    aggregateId, expectedVersion, commandId);
            throw conflict;
        }

        log.info("Conflict resolved as re-submitted command: aggregateId={}, commandId={}, version={}",
                aggregateId, commandId, produced.get(produced.size() - 1).version());
        return project(bookingId, produced);
    }

    private BookingCommandResult project(String bookingId, List<StoredEvent> events) {
        StoredEvent last = events.get(events.size() - 1);
        try {
            Booking booking = null;
            for (StoredEvent event : events) {
                booking = projectBookingEventUseCase.apply(event);
            }
            return BookingCommandResult.completed(last, booking);
        } catch (RuntimeException e) {
            // 이벤트는 이미 영속화됨: 어떤 실패든 조회 모델 지연으로 보고한다
            log.error("Projection failed after durable append: aggregateId={}, version={}, eventId={}",
                    last.aggregateId(), last.version(), last.eventId(), e);
            return BookingCommandResult.projectionPending(bookingId, last, e.getMessage());
        }
    }
}
