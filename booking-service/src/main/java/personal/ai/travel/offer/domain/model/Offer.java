package personal.ai.travel.offer.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Offer Domain Model
 * 외부 제공자가 돌려준 항공 상품 (조회 전용)
 */
public record Offer(
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
        int adults) {
}
