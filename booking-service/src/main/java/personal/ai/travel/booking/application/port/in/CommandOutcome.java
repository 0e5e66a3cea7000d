package personal.ai.travel.booking.application.port.in;

/**
 * 커맨드 처리 결과 구분
 */
public enum CommandOutcome {
    /** 이벤트 영속화 + 조회 모델 반영 완료 */
    COMPLETED,
    /** 이벤트는 영속화되었으나 조회 모델 반영 실패 (재생으로 복구 필요) */
    PROJECTION_PENDING
}
