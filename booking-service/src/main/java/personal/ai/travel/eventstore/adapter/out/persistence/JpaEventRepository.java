package personal.ai.travel.eventstore.adapter.out.persistence;

import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Event
 */
public interface JpaEventRepository extends JpaRepository<EventEntity, Long> {

    Optional<EventEntity> findFirstByAggregateIdOrderByVersionDesc(String aggregateId);

    List<EventEntity> findByAggregateIdAndVersionGreaterThanEqualOrderByVersionAsc(String aggregateId, long fromVersion);

    List<EventEntity> findByGlobalOffsetGreaterThanEqualOrderByGlobalOffsetAsc(long fromGlobalOffset, Limit limit);

    @Query("select e.aggregateId from EventEntity e where e.version = 1 order by e.globalOffset asc")
    List<String> findAllAggregateIds();
}
