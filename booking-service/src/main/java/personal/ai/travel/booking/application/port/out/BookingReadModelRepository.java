package personal.ai.travel.booking.application.port.out;

import personal.ai.travel.booking.domain.model.Booking;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Booking Read Model Repository (Output Port)
 * 예약 조회 모델 저장소. 이벤트 로그와 독립적으로 소유/정리된다
 */
public interface BookingReadModelRepository {

    Optional<Booking> findByBookingId(String bookingId);

    Optional<Booking> findByAggregateId(String aggregateId);

    /**
     * 반영 트랜잭션 동안 행 잠금을 잡고 조회 (같은 aggregate 반영 직렬화)
     */
    Optional<Booking> findByAggregateIdForUpdate(String aggregateId);

    /**
     * 사용자 예약 목록 (최신 생성순)
     */
    List<Booking> findByUserId(Long userId);

    /**
     * 행 저장 (없으면 생성, 있으면 전체 필드 교체)
     */
    Booking save(Booking booking);

    /**
     * 기준 시각 이전에 종료(CANCELLED)된 행 삭제. 이벤트 로그는 건드리지 않는다
     *
     * @return 삭제된 행 수
     */
    int deleteCancelledBefore(Instant before);
}
