package personal.ai.travel.offer.adapter.out.external;

import personal.ai.travel.offer.domain.model.Offer;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 제공자 상품 검색 응답 항목
 * GET /api/v1/offers
 */
public record OfferPayload(
        String id,
        String departure,
        String destination,
        LocalDate departDate,
        LocalDate returnDate,
        String airline,
        BigDecimal price,
        String currency,
        int durationMin,
        int stops,
        int adults) {

    public Offer toDomain() {
        return new Offer(id, departure, destination, departDate, returnDate, airline,
                price, currency, durationMin, stops, adults);
    }
}
