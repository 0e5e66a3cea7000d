package personal.ai.travel.booking.domain.service;

import org.springframework.stereotype.Component;
import personal.ai.travel.booking.domain.model.Booking;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Refund Policy (Domain Service)
 * 취소 시점과 출발일 사이 간격으로 환불액 결정
 *
 * - 출발 2일 전까지: 전액
 * - 출발 2일 미만: 50%
 * - 출발일 경과: 0
 */
@Component
public class RefundPolicy {

    static final long FULL_REFUND_DAYS = 2;
    private static final BigDecimal PARTIAL_RATE = new BigDecimal("0.50");

    public BigDecimal refundFor(Booking booking, LocalDate today) {
        long daysUntilDeparture = ChronoUnit.DAYS.between(today, booking.departDate());
        if (daysUntilDeparture < 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        if (daysUntilDeparture >= FULL_REFUND_DAYS) {
            return booking.price();
        }
        return booking.price().multiply(PARTIAL_RATE).setScale(2, RoundingMode.HALF_UP);
    }
}
