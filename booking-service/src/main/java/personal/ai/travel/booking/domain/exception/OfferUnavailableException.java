package personal.ai.travel.booking.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Offer Unavailable Exception
 * 상품이 더 이상 유효하지 않거나 잔여 수량이 부족할 때 발생 (이벤트는 기록되지 않음)
 */
public class OfferUnavailableException extends BusinessException {
    public OfferUnavailableException(String offerId, String reason) {
        super(ErrorCode.OFFER_UNAVAILABLE,
                String.format("Offer unavailable: offerId=%s, reason=%s", offerId, reason));
    }
}
