package personal.ai.travel.offer.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.offer.application.port.in.SearchOffersUseCase;
import personal.ai.travel.offer.application.port.out.OfferProvider;
import personal.ai.travel.offer.domain.model.Offer;
import personal.ai.travel.offer.domain.model.OfferSearchCriteria;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Offer Search Service
 * 읽기 전용 통과 조회: 이벤트 로그와 조회 모델에 접근하지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfferSearchService implements SearchOffersUseCase {

    public static final String CACHE_NAME = "offerSearch";

    private final OfferProvider offerProvider;
    private final Clock clock;

    /**
     * 상품 검색
     * 동일 조건은 짧은 TTL 동안 캐시 (spring.cache.redis.time-to-live)
     */
    @Override
    @Cacheable(cacheNames = CACHE_NAME, key = "#criteria.toString()")
    public List<Offer> searchOffers(OfferSearchCriteria criteria) {
        if (criteria.departDate().isBefore(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure date cannot be in the past");
        }

        List<Offer> offers = offerProvider.searchOffers(criteria).stream()
                .filter(criteria::withinBudget)
                .sorted(Comparator.comparing(Offer::price))
                .collect(Collectors.toCollection(ArrayList::new)); // 캐시 역직렬화 가능한 구현체

        log.info("Offers searched: departure={}, destination={}, departDate={}, results={}",
                criteria.departure(), criteria.destination(), criteria.departDate(), offers.size());
        return offers;
    }
}
