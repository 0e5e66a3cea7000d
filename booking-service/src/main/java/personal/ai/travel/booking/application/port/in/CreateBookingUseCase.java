package personal.ai.travel.booking.application.port.in;

/**
 * Create Booking UseCase (Input Port)
 * 예약 생성 유스케이스
 */
public interface CreateBookingUseCase {

    /**
     * 예약 생성
     * 제공자 검증 → BookingConfirmed append (version 1) → 조회 모델 동기 반영
     *
     * @throws personal.ai.travel.booking.domain.exception.OfferUnavailableException 상품이 유효하지 않거나 수량 부족 시
     * @throws personal.ai.travel.offer.domain.exception.ProviderException 제공자 장애/타임아웃 시 (이벤트 기록 없음)
     */
    BookingCommandResult create(CreateBookingCommand command);
}
