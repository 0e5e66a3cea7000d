package personal.ai.travel.offer.adapter.out.external;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import personal.ai.travel.offer.application.port.out.OfferProvider;
import personal.ai.travel.offer.domain.exception.ProviderException;
import personal.ai.travel.offer.domain.exception.ProviderTimeoutException;
import personal.ai.travel.offer.domain.model.Offer;
import personal.ai.travel.offer.domain.model.OfferSearchCriteria;
import personal.ai.travel.offer.domain.model.OfferValidation;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Optional;

/**
 * Offer Provider REST Client Adapter
 * 외부 상품 제공자와 HTTP 통신하는 구현체 (RestClient 사용)
 *
 * - Circuit Breaker: 장애 전파 차단 (Fail-Fast)
 * - Bulkhead: 동시 호출 수 제한
 * - Retry 없음: 제공자 오류는 호출자에게 그대로 전달
 * - 404: 존재하지 않는 상품 → valid=false (Circuit 실패 아님)
 * - 5xx, 연결 실패: ProviderException / 타임아웃: ProviderTimeoutException
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "external.offer-provider.mode", havingValue = "rest", matchIfMissing = true)
@RequiredArgsConstructor
public class OfferProviderRestClientAdapter implements OfferProvider {

    private final RestClient offerProviderRestClient;

    @Override
    @CircuitBreaker(name = "offerProvider", fallbackMethod = "validateOfferFallback")
    @Bulkhead(name = "offerProvider", fallbackMethod = "validateOfferFallback", type = Bulkhead.Type.SEMAPHORE)
    public OfferValidation validateOffer(String offerId) {
        log.debug("Validating offer: offerId={}", offerId);

        try {
            OfferAvailabilityPayload payload = offerProviderRestClient.get()
                    .uri("/api/v1/offers/{offerId}/availability", offerId)
                    .retrieve()
                    .onStatus(HttpStatusCode::is5xxServerError, (request, response) -> {
                        log.error("Offer provider unavailable: status={}", response.getStatusCode());
                        throw new ProviderException("Offer provider returned " + response.getStatusCode().value());
                    })
                    .body(OfferAvailabilityPayload.class);

            if (payload == null) {
                throw new ProviderException("Offer provider returned an empty availability response");
            }
            OfferValidation validation = payload.toDomain(offerId);
            log.debug("Offer validated: offerId={}, valid={}, capacity={}",
                    offerId, validation.valid(), validation.capacity());
            return validation;

        } catch (HttpClientErrorException.NotFound e) {
            log.info("Offer not found at provider: offerId={}", offerId);
            return OfferValidation.unavailable(offerId);

        } catch (HttpClientErrorException e) {
            log.warn("Offer provider rejected request: offerId={}, status={}", offerId, e.getStatusCode());
            throw new ProviderException("Offer provider rejected request with " + e.getStatusCode().value(), e);

        } catch (ResourceAccessException e) {
            throw translateIoFailure("validateOffer", e);
        }
    }

    @Override
    @CircuitBreaker(name = "offerProvider", fallbackMethod = "searchOffersFallback")
    @Bulkhead(name = "offerProvider", fallbackMethod = "searchOffersFallback", type = Bulkhead.Type.SEMAPHORE)
    public List<Offer> searchOffers(OfferSearchCriteria criteria) {
        log.debug("Searching offers at provider: departure={}, destination={}, departDate={}",
                criteria.departure(), criteria.destination(), criteria.departDate());

        try {
            List<OfferPayload> payloads = offerProviderRestClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/api/v1/offers")
                            .queryParam("origin", criteria.departure())
                            .queryParam("destination", criteria.destination())
                            .queryParam("departDate", criteria.departDate())
                            .queryParamIfPresent("returnDate", Optional.ofNullable(criteria.returnDate()))
                            .queryParam("adults", criteria.adults())
                            .build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        log.error("Offer search failed at provider: status={}", response.getStatusCode());
                        throw new ProviderException("Offer provider returned " + response.getStatusCode().value());
                    })
                    .body(new ParameterizedTypeReference<List<OfferPayload>>() {
                    });

            if (payloads == null) {
                return List.of();
            }
            return payloads.stream()
                    .map(OfferPayload::toDomain)
                    .toList();

        } catch (ResourceAccessException e) {
            throw translateIoFailure("searchOffers", e);
        }
    }

    /**
     * 이미 도메인 예외로 변환된 실패는 그대로 전달
     */
    private OfferValidation validateOfferFallback(String offerId, ProviderException e) {
        throw e;
    }

    /**
     * Fallback 메서드
     * Circuit Breaker Open 또는 Bulkhead Full 시 호출
     */
    private OfferValidation validateOfferFallback(String offerId, Exception e) {
        log.error("Offer provider circuit breaker opened or bulkhead full: offerId={}, error={}",
                offerId, e.getClass().getSimpleName(), e);
        throw new ProviderException("Offer provider is not accepting calls", e);
    }

    private List<Offer> searchOffersFallback(OfferSearchCriteria criteria, ProviderException e) {
        throw e;
    }

    private List<Offer> searchOffersFallback(OfferSearchCriteria criteria, Exception e) {
        log.error("Offer provider circuit breaker opened or bulkhead full: departure={}, destination={}, error={}",
                criteria.departure(), criteria.destination(), e.getClass().getSimpleName(), e);
        throw new ProviderException("Offer provider is not accepting calls", e);
    }

    private ProviderException translateIoFailure(String operation, ResourceAccessException e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
                log.error("Offer provider timed out: operation={}", operation);
                return new ProviderTimeoutException(operation, e);
            }
            cause = cause.getCause();
        }
        log.error("Offer provider unreachable: operation={}, error={}", operation, e.getMessage());
        return new ProviderException("Offer provider unreachable during " + operation, e);
    }
}
