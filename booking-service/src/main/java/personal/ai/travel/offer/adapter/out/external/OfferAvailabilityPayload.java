package personal.ai.travel.offer.adapter.out.external;

import personal.ai.travel.offer.domain.model.OfferValidation;

import java.math.BigDecimal;

/**
 * 제공자 상품 가용성 응답
 * GET /api/v1/offers/{offerId}/availability
 */
public record OfferAvailabilityPayload(
        String offerId,
        boolean available,
        BigDecimal price,
        String currency,
        int seatsLeft) {

    public OfferValidation toDomain(String requestedOfferId) {
        if (!available || price == null) {
            return OfferValidation.unavailable(requestedOfferId);
        }
        return new OfferValidation(requestedOfferId, true, price, currency, Math.max(0, seatsLeft));
    }
}
