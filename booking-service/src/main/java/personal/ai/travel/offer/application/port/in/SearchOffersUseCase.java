package personal.ai.travel.offer.application.port.in;

import personal.ai.travel.offer.domain.model.Offer;
import personal.ai.travel.offer.domain.model.OfferSearchCriteria;

import java.util.List;

/**
 * Search Offers UseCase (Input Port)
 * 제공자 검색 결과를 예산으로 거르고 가격순으로 정렬해 반환
 */
public interface SearchOffersUseCase {

    List<Offer> searchOffers(OfferSearchCriteria criteria);
}
