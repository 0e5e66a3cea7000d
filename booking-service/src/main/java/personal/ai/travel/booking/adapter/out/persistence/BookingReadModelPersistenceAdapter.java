package personal.ai.travel.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.travel.booking.application.port.out.BookingReadModelRepository;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Booking Read Model Persistence Adapter
 * JPA를 사용한 예약 조회 모델 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingReadModelPersistenceAdapter implements BookingReadModelRepository {

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Optional<Booking> findByBookingId(String bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByAggregateId(String aggregateId) {
        return jpaBookingRepository.findByAggregateId(aggregateId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByAggregateIdForUpdate(String aggregateId) {
        return jpaBookingRepository.findByAggregateIdForUpdate(aggregateId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public List<Booking> findByUserId(Long userId) {
        return jpaBookingRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking row: bookingId={}, status={}, lastVersion={}",
                booking.bookingId(), booking.status(), booking.lastVersion());
        return jpaBookingRepository.save(BookingEntity.fromDomain(booking)).toDomain();
    }

    @Override
    @Transactional
    public int deleteCancelledBefore(Instant before) {
        int deleted = jpaBookingRepository.deleteByStatusAndUpdatedAtBefore(BookingStatus.CANCELLED, before);
        log.info("Cancelled booking rows pruned: before={}, deleted={}", before, deleted);
        return deleted;
    }
}
