package personal.ai.travel.eventstore.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.eventstore.application.port.out.EventLog;
import personal.ai.travel.eventstore.domain.exception.ConcurrencyConflictException;
import personal.ai.travel.eventstore.domain.exception.EventStorageException;
import personal.ai.travel.eventstore.domain.model.EventDraft;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Event Log Persistence Adapter
 * JPA를 사용한 이벤트 로그 구현체
 *
 * 동시성 전략:
 * - event_log_head 행 잠금 아래에서 global offset 부여 (offset 순서 = 커밋 순서)
 * - 1차: 현재 버전과 expectedVersion 비교 (낙관적 동시성)
 * - 2차: (aggregate_id, version) Unique Index 위반 → ConcurrencyConflictException
 * append는 단일 트랜잭션이므로 배치 일부만 보이는 경우는 없다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventLogPersistenceAdapter implements EventLog {

    private final JpaEventRepository jpaEventRepository;
    private final JpaEventLogHeadRepository jpaEventLogHeadRepository;
    private final EventLogHeadInitializer eventLogHeadInitializer;
    private final Clock clock;

    @Override
    @Transactional
    public List<StoredEvent> append(String aggregateId, long expectedVersion, List<EventDraft> drafts) {
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Aggregate ID cannot be null or blank");
        }
        if (drafts == null || drafts.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event drafts cannot be empty");
        }

        try {
            EventLogHeadEntity head = lockHead(aggregateId);

            Optional<EventEntity> last = jpaEventRepository.findFirstByAggregateIdOrderByVersionDesc(aggregateId);
            long currentVersion = last.map(EventEntity::getVersion).orElse(0L);
            if (currentVersion != expectedVersion) {
                log.warn("Stale expected version: aggregateId={}, expected={}, actual={}",
                        aggregateId, expectedVersion, currentVersion);
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
            }

            // 시계가 역행해도 aggregate 내 타임스탬프는 감소하지 않는다
            Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
            Instant occurredAt = last.map(EventEntity::getOccurredAt)
                    .filter(previous -> previous.isAfter(now))
                    .orElse(now);

            long offset = head.reserve(drafts.size());
            List<EventEntity> entities = new ArrayList<>(drafts.size());
            long version = expectedVersion;
            for (EventDraft draft : drafts) {
                version++;
                entities.add(EventEntity.of(offset++, UUID.randomUUID().toString(), aggregateId, version,
                        occurredAt, draft));
            }

            List<StoredEvent> stored = jpaEventRepository.saveAllAndFlush(entities).stream()
                    .map(EventEntity::toDomain)
                    .toList();

            log.debug("Events appended: aggregateId={}, fromVersion={}, toVersion={}",
                    aggregateId, expectedVersion + 1, version);
            return stored;

        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            log.warn("Concurrent append detected: aggregateId={}, expectedVersion={}", aggregateId, expectedVersion);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, e);

        } catch (DataAccessException e) {
            log.error("Failed to append events: aggregateId={}, expectedVersion={}", aggregateId, expectedVersion, e);
            throw new EventStorageException(aggregateId, e);
        }
    }

    /**
     * log head 행을 트랜잭션 종료까지 잠근다 (없으면 별도 트랜잭션에서 생성 후 잠금)
     */
    private EventLogHeadEntity lockHead(String aggregateId) {
        try {
            Optional<EventLogHeadEntity> head = jpaEventLogHeadRepository.findByIdForUpdate(EventLogHeadEntity.HEAD_ID);
            if (head.isPresent()) {
                return head.get();
            }
            try {
                eventLogHeadInitializer.createIfAbsent();
            } catch (DataIntegrityViolationException e) {
                log.debug("Event log head created concurrently: aggregateId={}", aggregateId);
            }
            return jpaEventLogHeadRepository.findByIdForUpdate(EventLogHeadEntity.HEAD_ID)
                    .orElseThrow(() -> new IllegalStateException("Event log head missing after initialization"));

        } catch (PessimisticLockingFailureException e) {
            log.error("Failed to lock event log head: aggregateId={}", aggregateId, e);
            throw new EventStorageException(aggregateId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredEvent> read(String aggregateId, long fromVersion) {
        log.debug("Reading stream: aggregateId={}, fromVersion={}", aggregateId, fromVersion);
        return jpaEventRepository
                .findByAggregateIdAndVersionGreaterThanEqualOrderByVersionAsc(aggregateId, Math.max(1, fromVersion))
                .stream()
                .map(EventEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredEvent> readAll(long fromGlobalOffset, int limit) {
        log.debug("Reading global stream: fromOffset={}, limit={}", fromGlobalOffset, limit);
        return jpaEventRepository
                .findByGlobalOffsetGreaterThanEqualOrderByGlobalOffsetAsc(fromGlobalOffset, Limit.of(limit))
                .stream()
                .map(EventEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long currentVersion(String aggregateId) {
        return jpaEventRepository.findFirstByAggregateIdOrderByVersionDesc(aggregateId)
                .map(EventEntity::getVersion)
                .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return jpaEventRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> aggregateIds() {
        return jpaEventRepository.findAllAggregateIds();
    }
}
