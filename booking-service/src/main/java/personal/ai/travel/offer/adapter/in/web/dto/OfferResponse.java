package personal.ai.travel.offer.adapter.in.web.dto;

import personal.ai.travel.offer.domain.model.Offer;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 상품 검색 응답 DTO
 */
public record OfferResponse(
        String offerId,
        String departure,
        String destination,
        LocalDate departDate,
        LocalDate returnDate,
        String airline,
        BigDecimal price,
        String currency,
        int durationMinutes,
        int stops,
        int adults
) {
    public static OfferResponse from(Offer offer) {
        return new OfferResponse(
                offer.offerId(),
                offer.departure(),
                offer.destination(),
                offer.departDate(),
                offer.returnDate(),
                offer.airline(),
                offer.price(),
                offer.currency(),
                offer.durationMinutes(),
                offer.stops(),
                offer.adults()
        );
    }
}
