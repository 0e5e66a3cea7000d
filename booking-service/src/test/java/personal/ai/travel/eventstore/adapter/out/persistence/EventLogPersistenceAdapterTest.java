package personal.ai.travel.eventstore.adapter.out.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import personal.ai.common.exception.BusinessException;
import personal.ai.travel.config.ClockConfig;
import personal.ai.travel.eventstore.domain.exception.ConcurrencyConflictException;
import personal.ai.travel.eventstore.domain.model.EventDraft;
import personal.ai.travel.eventstore.domain.model.StoredEvent;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({EventLogPersistenceAdapter.class, EventLogHeadInitializer.class, ClockConfig.class})
@DisplayName("EventLogPersistenceAdapter 통합 테스트 (H2)")
class EventLogPersistenceAdapterTest {

    @Autowired
    private EventLogPersistenceAdapter eventLog;

    private static EventDraft draft(String type, String commandId) {
        return new EventDraft(type, 1, "{\"n\":1}", commandId);
    }

    @Test
    @DisplayName("새 스트림 append는 version 1부터 연속 버전을 부여한다")
    void append_NewStream_AssignsContiguousVersions() {
        // when
        List<StoredEvent> stored = eventLog.append("agg-1", 0,
                List.of(draft("BookingConfirmed", "cmd-1"), draft("BookingAmended", "cmd-1")));

        // then
        assertThat(stored).extracting(StoredEvent::version).containsExactly(1L, 2L);
        assertThat(stored).extracting(StoredEvent::eventId).doesNotHaveDuplicates();
        assertThat(stored.get(0).globalOffset()).isLessThan(stored.get(1).globalOffset());
        assertThat(stored.get(0).commandId()).isEqualTo("cmd-1");
        assertThat(eventLog.currentVersion("agg-1")).isEqualTo(2);
    }

    @Test
    @DisplayName("기대 버전이 낡았으면 ConcurrencyConflictException, 로그는 변하지 않는다")
    void append_StaleExpectedVersion_Conflict() {
        // given
        eventLog.append("agg-1", 0, List.of(draft("BookingConfirmed", null)));
        eventLog.append("agg-1", 1, List.of(draft("BookingCancelled", null)));
        long before = eventLog.count();

        // when & then
        assertThatThrownBy(() -> eventLog.append("agg-1", 1, List.of(draft("BookingCancelled", null))))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("expectedVersion=1")
                .hasMessageContaining("actualVersion=2");
        assertThat(eventLog.count()).isEqualTo(before);
    }

    @Test
    @DisplayName("빈 초안 목록은 INVALID_INPUT")
    void append_EmptyDrafts_Rejected() {
        assertThatThrownBy(() -> eventLog.append("agg-1", 0, List.of()))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("스트림은 버전 순, 전체 조회는 global offset 순으로 돌려준다")
    void read_And_ReadAll_Ordering() {
        // given
        eventLog.append("agg-a", 0, List.of(draft("BookingConfirmed", null)));
        eventLog.append("agg-b", 0, List.of(draft("BookingConfirmed", null)));
        eventLog.append("agg-a", 1, List.of(draft("BookingCancelled", null)));

        // when
        List<StoredEvent> streamA = eventLog.read("agg-a");
        List<StoredEvent> all = eventLog.readAll(0);
        List<StoredEvent> fromSecond = eventLog.readAll(all.get(1).globalOffset(), 10);

        // then
        assertThat(streamA).extracting(StoredEvent::version).containsExactly(1L, 2L);
        assertThat(all).extracting(StoredEvent::aggregateId).containsExactly("agg-a", "agg-b", "agg-a");
        assertThat(fromSecond).hasSize(2);
        assertThat(eventLog.read("agg-a", 2)).singleElement()
                .extracting(StoredEvent::eventType).isEqualTo("BookingCancelled");
        assertThat(eventLog.read("missing")).isEmpty();
        assertThat(eventLog.aggregateIds()).containsExactly("agg-a", "agg-b");
    }

    @Test
    @DisplayName("같은 aggregate의 타임스탬프는 감소하지 않는다")
    void append_TimestampsNonDecreasing() {
        // given
        eventLog.append("agg-1", 0, List.of(draft("BookingConfirmed", null)));
        eventLog.append("agg-1", 1, List.of(draft("BookingAmended", null)));

        // when
        List<StoredEvent> stream = eventLog.read("agg-1");

        // then
        assertThat(stream.get(1).timestamp()).isAfterOrEqualTo(stream.get(0).timestamp());
    }
}
