package personal.ai.travel.eventstore.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Event Log Head JPA Entity
 * 마지막으로 부여한 global offset을 담는 단일 행
 *
 * append 트랜잭션이 이 행을 잠근 채 offset을 부여하므로
 * offset 순서가 커밋 순서와 같다 (커밋되지 않은 낮은 offset 뒤에 높은 offset이 먼저 보이지 않음)
 */
@Entity
@Table(name = "event_log_head")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventLogHeadEntity {

    public static final int HEAD_ID = 1;

    @Id
    private Integer id;

    @Column(name = "last_offset", nullable = false)
    private long lastOffset;

    public static EventLogHeadEntity initial() {
        EventLogHeadEntity head = new EventLogHeadEntity();
        head.id = HEAD_ID;
        head.lastOffset = 0;
        return head;
    }

    /**
     * count개의 연속 offset을 예약하고 첫 offset을 돌려준다
     */
    public long reserve(int count) {
        long first = lastOffset + 1;
        lastOffset += count;
        return first;
    }
}
