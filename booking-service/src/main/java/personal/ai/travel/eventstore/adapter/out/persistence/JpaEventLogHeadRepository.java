package personal.ai.travel.eventstore.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Event Log Head
 */
public interface JpaEventLogHeadRepository extends JpaRepository<EventLogHeadEntity, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from EventLogHeadEntity h where h.id = :id")
    Optional<EventLogHeadEntity> findByIdForUpdate(@Param("id") Integer id);
}
