package personal.ai.travel.booking.application.port.in;

import personal.ai.travel.booking.domain.model.Booking;

import java.time.Instant;

/**
 * Rebuild Read Model UseCase (Input Port)
 * 재생/감사 인터페이스: 조회 모델 재구성 및 정리
 */
public interface RebuildReadModelUseCase {

    Booking rebuildReadModel(String aggregateId);

    /**
     * 이벤트 로그의 모든 aggregate 재구성. 실패한 aggregate는 보고하고 나머지는 계속 진행
     */
    RebuildReport rebuildAll();

    /**
     * 기준 시각 이전에 취소된 조회 모델 행 삭제 (이벤트 로그는 유지)
     */
    int pruneCancelledBefore(Instant before);
}
