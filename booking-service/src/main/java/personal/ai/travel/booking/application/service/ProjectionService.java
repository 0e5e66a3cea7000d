package personal.ai.travel.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.travel.booking.application.port.in.ProjectBookingEventUseCase;
import personal.ai.travel.booking.application.port.out.BookingEventCodec;
import personal.ai.travel.booking.application.port.out.BookingReadModelRepository;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingEventEnvelope;
import personal.ai.travel.booking.domain.service.BookingProjector;
import personal.ai.travel.eventstore.application.port.out.EventLog;
import personal.ai.travel.eventstore.domain.exception.AggregateNotFoundException;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.util.List;

/**
 * Projection Service (Projection Engine)
 * 이벤트 로그 → 예약 조회 모델 반영
 *
 * - 반영은 append와 별도 트랜잭션 (append가 유일한 내구성 경계)
 * - 같은 aggregate 반영은 행 잠금으로 직렬화
 * - 행이 뒤처져 있으면(버전 공백) 로그에서 누락분을 먼저 따라잡는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectionService implements ProjectBookingEventUseCase {

    private final EventLog eventLog;
    private final BookingReadModelRepository bookingReadModelRepository;
    private final BookingEventCodec bookingEventCodec;
    private final BookingProjector bookingProjector;

    @Override
    @Transactional
    public Booking apply(StoredEvent event) {
        BookingEventEnvelope envelope = bookingEventCodec.decode(event);

        Booking current = bookingReadModelRepository.findByAggregateIdForUpdate(event.aggregateId())
                .orElse(null);
        long lastVersion = current == null ? 0 : current.lastVersion();

        if (event.version() <= lastVersion) {
            log.debug("Event already projected: aggregateId={}, version={}, lastVersion={}",
                    event.aggregateId(), event.version(), lastVersion);
            return current;
        }

        Booking projected = current;
        if (event.version() > lastVersion + 1) {
            log.info("Read model behind, catching up: aggregateId={}, lastVersion={}, targetVersion={}",
                    event.aggregateId(), lastVersion, event.version());
            for (StoredEvent missing : eventLog.read(event.aggregateId(), lastVersion + 1)) {
                if (missing.version() >= event.version()) {
                    break;
                }
                projected = bookingProjector.project(projected, bookingEventCodec.decode(missing));
            }
        }

        projected = bookingProjector.project(projected, envelope);
        Booking saved = bookingReadModelRepository.save(projected);

        log.debug("Event projected: aggregateId={}, version={}, type={}, status={}",
                event.aggregateId(), event.version(), event.eventType(), saved.status());
        return saved;
    }

    @Override
    @Transactional
    public Booking rebuild(String aggregateId) {
        // 스트림을 읽기 전에 행을 잠근다: 읽은 뒤 반영된 새 버전을 덮어쓰지 않도록
        bookingReadModelRepository.findByAggregateIdForUpdate(aggregateId);

        List<StoredEvent> events = eventLog.read(aggregateId);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateId);
        }

        // 기존 행 내용은 사용하지 않고 전체 필드를 교체
        Booking rebuilt = bookingProjector.fold(events.stream()
                .map(bookingEventCodec::decode)
                .toList());
        Booking saved = bookingReadModelRepository.save(rebuilt);

        log.info("Read model rebuilt: aggregateId={}, events={}, lastVersion={}, status={}",
                aggregateId, events.size(), saved.lastVersion(), saved.status());
        return saved;
    }
}
