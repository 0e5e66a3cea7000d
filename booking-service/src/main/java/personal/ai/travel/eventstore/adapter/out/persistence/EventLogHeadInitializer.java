package personal.ai.travel.eventstore.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Event Log Head 행 생성
 * append 트랜잭션과 분리된 트랜잭션에서 커밋해야 다른 append도 같은 행을 잠글 수 있다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventLogHeadInitializer {

    private final JpaEventLogHeadRepository jpaEventLogHeadRepository;

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException 다른 트랜잭션이 동시에 생성한 경우
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createIfAbsent() {
        if (jpaEventLogHeadRepository.existsById(EventLogHeadEntity.HEAD_ID)) {
            return;
        }
        jpaEventLogHeadRepository.saveAndFlush(EventLogHeadEntity.initial());
        log.info("Event log head created");
    }
}
