package personal.ai.travel.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.ai.travel.booking.domain.model.BookingStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, String> {

    Optional<BookingEntity> findByAggregateId(String aggregateId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from BookingEntity b where b.aggregateId = :aggregateId")
    Optional<BookingEntity> findByAggregateIdForUpdate(@Param("aggregateId") String aggregateId);

    List<BookingEntity> findByUserIdOrderByCreatedAtDesc(Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from BookingEntity b where b.status = :status and b.updatedAt < :before")
    int deleteByStatusAndUpdatedAtBefore(@Param("status") BookingStatus status, @Param("before") Instant before);
}
