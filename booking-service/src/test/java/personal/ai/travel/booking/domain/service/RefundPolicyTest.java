package personal.ai.travel.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingStatus;
import personal.ai.travel.booking.domain.model.BookingType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RefundPolicy 단위 테스트")
class RefundPolicyTest {

    private static final LocalDate DEPART = LocalDate.of(2026, 12, 10);

    private final RefundPolicy refundPolicy = new RefundPolicy();

    private static Booking booking(String price) {
        Instant now = Instant.parse("2026-10-01T00:00:00Z");
        return new Booking("bk-1", "agg-1", 1L, BookingType.FLIGHT, "OFR-1", "TLV", "PAR",
                DEPART, null, null, 1, new BigDecimal(price), "EUR", BookingStatus.CONFIRMED,
                null, null, now, now, "evt-1", 1);
    }

    @Test
    @DisplayName("출발 2일 전까지는 전액 환불")
    void refund_TwoDaysBefore_FullPrice() {
        assertThat(refundPolicy.refundFor(booking("250"), DEPART.minusDays(2))).isEqualByComparingTo("250.00");
    }

    @Test
    @DisplayName("출발 2일 미만이면 50% 환불")
    void refund_DayBefore_Half() {
        assertThat(refundPolicy.refundFor(booking("99.99"), DEPART.minusDays(1))).isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("출발일이 지나면 환불 없음")
    void refund_AfterDeparture_Zero() {
        assertThat(refundPolicy.refundFor(booking("250"), DEPART.plusDays(1))).isEqualByComparingTo("0");
    }
}
