package personal.ai.travel.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.travel.booking.application.port.in.ProjectBookingEventUseCase;
import personal.ai.travel.booking.application.port.in.RebuildReadModelUseCase;
import personal.ai.travel.booking.application.port.in.RebuildReport;
import personal.ai.travel.booking.application.port.out.BookingReadModelRepository;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.eventstore.application.port.out.EventLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read Model Admin Service
 * 재생/감사: aggregate 단위 재구성은 ProjectionService 트랜잭션을 하나씩 사용한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadModelAdminService implements RebuildReadModelUseCase {

    private final EventLog eventLog;
    private final ProjectBookingEventUseCase projectBookingEventUseCase;
    private final BookingReadModelRepository bookingReadModelRepository;

    @Override
    public Booking rebuildReadModel(String aggregateId) {
        log.info("Rebuild requested: aggregateId={}", aggregateId);
        return projectBookingEventUseCase.rebuild(aggregateId);
    }

    @Override
    public RebuildReport rebuildAll() {
        List<String> aggregateIds = eventLog.aggregateIds();
        log.info("Full rebuild started: aggregates={}", aggregateIds.size());

        int rebuilt = 0;
        List<RebuildReport.Failure> failures = new ArrayList<>();
        for (String aggregateId : aggregateIds) {
            try {
                projectBookingEventUseCase.rebuild(aggregateId);
                rebuilt++;
            } catch (BusinessException | DataAccessException e) {
                log.error("Rebuild failed, continuing with next aggregate: aggregateId={}, error={}",
                        aggregateId, e.getMessage(), e);
                failures.add(new RebuildReport.Failure(aggregateId, e.getMessage()));
            }
        }

        log.info("Full rebuild finished: rebuilt={}, failed={}", rebuilt, failures.size());
        return new RebuildReport(rebuilt, List.copyOf(failures));
    }

    @Override
    public int pruneCancelledBefore(Instant before) {
        return bookingReadModelRepository.deleteCancelledBefore(before);
    }
}
