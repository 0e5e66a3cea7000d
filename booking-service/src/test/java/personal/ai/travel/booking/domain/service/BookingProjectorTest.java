package personal.ai.travel.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.travel.booking.domain.exception.ProjectionException;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingAmended;
import personal.ai.travel.booking.domain.model.BookingCancelled;
import personal.ai.travel.booking.domain.model.BookingConfirmed;
import personal.ai.travel.booking.domain.model.BookingEvent;
import personal.ai.travel.booking.domain.model.BookingEventEnvelope;
import personal.ai.travel.booking.domain.model.BookingStatus;
import personal.ai.travel.booking.domain.model.BookingType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BookingProjector 단위 테스트")
class BookingProjectorTest {

    private static final String AGGREGATE_ID = "agg-1";
    private static final Instant T0 = Instant.parse("2026-10-01T10:00:00Z");

    private final BookingProjector projector = new BookingProjector();

    private static BookingConfirmed confirmed() {
        return new BookingConfirmed("bk-1", BookingType.FLIGHT, "OFR-1", 7L, "TLV", "PAR",
                LocalDate.of(2026, 12, 1), LocalDate.of(2026, 12, 8), null, 2,
                new BigDecimal("250"), "EUR");
    }

    private static BookingEventEnvelope envelope(long version, BookingEvent event) {
        return new BookingEventEnvelope("evt-" + version, AGGREGATE_ID, version,
                T0.plusSeconds(version), "cmd-" + version, event);
    }

    @Test
    @DisplayName("BookingConfirmed는 CONFIRMED 행을 생성한다")
    void project_Confirmed_CreatesRow() {
        // when
        Booking booking = projector.project(null, envelope(1, confirmed()));

        // then
        assertThat(booking.bookingId()).isEqualTo("bk-1");
        assertThat(booking.aggregateId()).isEqualTo(AGGREGATE_ID);
        assertThat(booking.status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.price()).isEqualByComparingTo("250");
        assertThat(booking.lastVersion()).isEqualTo(1);
        assertThat(booking.lastEventId()).isEqualTo("evt-1");
        assertThat(booking.createdAt()).isEqualTo(booking.updatedAt());
    }

    @Test
    @DisplayName("BookingCancelled는 CANCELLED로 전이하고 환불액과 사유를 기록한다")
    void project_Cancelled_TransitionsToCancelled() {
        // given
        Booking booking = projector.project(null, envelope(1, confirmed()));

        // when
        Booking cancelled = projector.project(booking,
                envelope(2, new BookingCancelled("plans changed", new BigDecimal("250"))));

        // then
        assertThat(cancelled.status()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(cancelled.cancellationReason()).isEqualTo("plans changed");
        assertThat(cancelled.refundAmount()).isEqualByComparingTo("250");
        assertThat(cancelled.lastVersion()).isEqualTo(2);
        assertThat(cancelled.createdAt()).isEqualTo(booking.createdAt());
        assertThat(cancelled.updatedAt()).isAfter(booking.updatedAt());
    }

    @Test
    @DisplayName("BookingAmended는 날짜/인원/가격만 교체한다")
    void project_Amended_ReplacesAmendableFields() {
        // given
        Booking booking = projector.project(null, envelope(1, confirmed()));
        BookingAmended amended = new BookingAmended(LocalDate.of(2026, 12, 3), null, 3,
                new BigDecimal("310.5"), "EUR");

        // when
        Booking result = projector.project(booking, envelope(2, amended));

        // then
        assertThat(result.departDate()).isEqualTo(LocalDate.of(2026, 12, 3));
        assertThat(result.returnDate()).isNull();
        assertThat(result.passengers()).isEqualTo(3);
        assertThat(result.price()).isEqualByComparingTo("310.50");
        assertThat(result.offerId()).isEqualTo("OFR-1");
        assertThat(result.status()).isEqualTo(BookingStatus.CONFIRMED);
    }

    @Test
    @DisplayName("이미 반영된 버전은 무시한다 (멱등)")
    void project_AlreadyApplied_IsNoOp() {
        // given
        BookingEventEnvelope first = envelope(1, confirmed());
        Booking booking = projector.project(null, first);

        // when
        Booking again = projector.project(booking, first);

        // then
        assertThat(again).isSameAs(booking);
    }

    @Test
    @DisplayName("버전 공백이 있으면 ProjectionException")
    void project_VersionGap_Fails() {
        // given
        Booking booking = projector.project(null, envelope(1, confirmed()));

        // when & then
        assertThatThrownBy(() -> projector.project(booking,
                envelope(3, new BookingCancelled(null, BigDecimal.ZERO))))
                .isInstanceOf(ProjectionException.class)
                .hasMessageContaining("version gap");
    }

    @Test
    @DisplayName("행 없이 들어온 변경 이벤트는 ProjectionException")
    void project_CancelWithoutRow_Fails() {
        assertThatThrownBy(() -> projector.project(null,
                envelope(1, new BookingCancelled(null, BigDecimal.ZERO))))
                .isInstanceOf(ProjectionException.class)
                .hasMessageContaining("without a created booking");
    }

    @Test
    @DisplayName("취소된 예약 이후의 이벤트는 ProjectionException")
    void project_AfterTerminalState_Fails() {
        // given
        Booking booking = projector.fold(List.of(
                envelope(1, confirmed()),
                envelope(2, new BookingCancelled(null, BigDecimal.ZERO))));

        // when & then
        assertThatThrownBy(() -> projector.project(booking,
                envelope(3, new BookingAmended(LocalDate.of(2026, 12, 2), null, 1, BigDecimal.TEN, "EUR"))))
                .isInstanceOf(ProjectionException.class);
    }

    @Test
    @DisplayName("증분 반영 결과와 전체 재생 결과는 같다")
    void fold_EqualsIncrementalProjection() {
        // given
        List<BookingEventEnvelope> stream = List.of(
                envelope(1, confirmed()),
                envelope(2, new BookingAmended(LocalDate.of(2026, 12, 2), LocalDate.of(2026, 12, 9), 1,
                        new BigDecimal("199.99"), "EUR")),
                envelope(3, new BookingCancelled("weather", new BigDecimal("100"))));

        Booking incremental = null;
        List<BookingEventEnvelope> delivered = new ArrayList<>(stream);
        delivered.add(stream.get(1)); // 중복 전달
        for (BookingEventEnvelope envelope : delivered) {
            incremental = projector.project(incremental, envelope);
        }

        // when
        Booking replayed = projector.fold(stream);

        // then
        assertThat(replayed).isEqualTo(incremental);
    }
}
