package personal.ai.travel.offer.domain.model;

import java.math.BigDecimal;

/**
 * 상품 유효성 검증 결과
 *
 * @param valid    예약 가능 여부
 * @param price    현재 판매가 (유효하지 않으면 null)
 * @param currency 통화 (제공자가 주지 않으면 null)
 * @param capacity 잔여 수량
 */
public record OfferValidation(
        String offerId,
        boolean valid,
        BigDecimal price,
        String currency,
        int capacity) {

    public static OfferValidation unavailable(String offerId) {
        return new OfferValidation(offerId, false, null, null, 0);
    }

    public boolean canAccommodate(int passengers) {
        return valid && capacity >= passengers;
    }
}
