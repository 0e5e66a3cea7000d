package personal.ai.travel.offer.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 상품 검색 조건
 * 날짜의 과거 여부는 시계가 필요하므로 서비스에서 검증한다
 */
public record OfferSearchCriteria(
        String departure,
        String destination,
        LocalDate departDate,
        LocalDate returnDate,
        int adults,
        BigDecimal maxBudget) {

    public static final int MIN_ADULTS = 1;
    public static final int MAX_ADULTS = 9;

    public OfferSearchCriteria {
        if (departure == null || departure.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure cannot be null or blank");
        }
        if (destination == null || destination.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Destination cannot be null or blank");
        }
        if (departDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure date cannot be null");
        }
        if (returnDate != null && !returnDate.isAfter(departDate)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Return date must be after departure date");
        }
        if (adults < MIN_ADULTS || adults > MAX_ADULTS) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Adults must be between %d and %d", MIN_ADULTS, MAX_ADULTS));
        }
        if (maxBudget != null && maxBudget.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Budget cannot be negative");
        }
        departure = departure.trim();
        destination = destination.trim();
    }

    public boolean withinBudget(Offer offer) {
        return maxBudget == null || offer.price().compareTo(maxBudget) <= 0;
    }
}
