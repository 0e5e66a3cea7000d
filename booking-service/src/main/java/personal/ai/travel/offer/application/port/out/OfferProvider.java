package personal.ai.travel.offer.application.port.out;

import personal.ai.travel.offer.domain.model.Offer;
import personal.ai.travel.offer.domain.model.OfferSearchCriteria;
import personal.ai.travel.offer.domain.model.OfferValidation;

import java.util.List;

/**
 * Offer Provider (Output Port)
 * 외부 항공/숙소 상품 제공자 연동 인터페이스
 */
public interface OfferProvider {

    /**
     * 상품 예약 가능 여부 검증
     *
     * @param offerId 상품 ID
     * @return 유효성, 현재가, 잔여 수량 (존재하지 않는 상품은 valid=false)
     * @throws personal.ai.travel.offer.domain.exception.ProviderException 제공자 장애 시
     * @throws personal.ai.travel.offer.domain.exception.ProviderTimeoutException 타임아웃 시
     */
    OfferValidation validateOffer(String offerId);

    /**
     * 상품 검색
     *
     * @throws personal.ai.travel.offer.domain.exception.ProviderException 제공자 장애 시
     */
    List<Offer> searchOffers(OfferSearchCriteria criteria);
}
