package personal.ai.travel.booking.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.common.exception.BusinessException;
import personal.ai.travel.booking.application.port.in.AmendBookingCommand;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CommandOutcome;
import personal.ai.travel.booking.application.port.out.BookingReadModelRepository;
import personal.ai.travel.booking.domain.exception.OfferUnavailableException;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingAmended;
import personal.ai.travel.booking.domain.model.BookingEvent;
import personal.ai.travel.booking.domain.model.BookingStatus;
import personal.ai.travel.booking.domain.model.BookingType;
import personal.ai.travel.offer.application.port.out.OfferProvider;
import personal.ai.travel.offer.domain.model.OfferValidation;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AmendBookingService 단위 테스트")
class AmendBookingServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-01T00:00:00Z");
    private static final LocalDate DEPART = LocalDate.of(2026, 12, 1);
    private static final String BOOKING_ID = "bk-1";

    @Mock
    private BookingReadModelRepository bookingReadModelRepository;
    @Mock
    private OfferProvider offerProvider;
    @Mock
    private BookingCommandExecutor commandExecutor;

    private AmendBookingService amendBookingService;

    @BeforeEach
    void setUp() {
        amendBookingService = new AmendBookingService(bookingReadModelRepository, offerProvider, commandExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC));
        given(bookingReadModelRepository.findByBookingId(BOOKING_ID)).willReturn(Optional.of(
                new Booking(BOOKING_ID, "agg-1", 1L, BookingType.FLIGHT, "OFR-1", "TLV", "PAR",
                        DEPART, DEPART.plusDays(7), null, 2, new BigDecimal("250"), "EUR",
                        BookingStatus.CONFIRMED, null, null, NOW, NOW, "evt-1", 1)));
    }

    @Test
    @DisplayName("변경하지 않은 필드는 유지하고 제공자 현재가로 재가격한다")
    void amend_MergesFieldsAndReprices() {
        // given
        given(offerProvider.validateOffer("OFR-1"))
                .willReturn(new OfferValidation("OFR-1", true, new BigDecimal("275"), "EUR", 1));
        given(commandExecutor.execute(eq("agg-1"), eq(BOOKING_ID), eq(1L), isNull(), any()))
                .willReturn(new BookingCommandResult(CommandOutcome.COMPLETED, BOOKING_ID, "agg-1",
                        "evt-2", 2, null, null));

        // when
        amendBookingService.amend(new AmendBookingCommand(null, BOOKING_ID, null, null, null, 3));

        // then
        ArgumentCaptor<BookingEvent> event = ArgumentCaptor.forClass(BookingEvent.class);
        verify(commandExecutor).execute(eq("agg-1"), eq(BOOKING_ID), eq(1L), isNull(), event.capture());
        BookingAmended amended = (BookingAmended) event.getValue();
        assertThat(amended.departDate()).isEqualTo(DEPART);
        assertThat(amended.returnDate()).isEqualTo(DEPART.plusDays(7));
        assertThat(amended.passengers()).isEqualTo(3);
        assertThat(amended.price()).isEqualByComparingTo("275");
    }

    @Test
    @DisplayName("추가 인원을 수용할 수 없으면 OfferUnavailableException")
    void amend_NotEnoughCapacity() {
        // given
        given(offerProvider.validateOffer("OFR-1"))
                .willReturn(new OfferValidation("OFR-1", true, new BigDecimal("275"), "EUR", 1));

        // when & then
        assertThatThrownBy(() -> amendBookingService.amend(
                new AmendBookingCommand(null, BOOKING_ID, null, null, null, 5)))
                .isInstanceOf(OfferUnavailableException.class);
        verify(commandExecutor, never()).execute(any(), any(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("변경 후 귀국일이 출발일보다 빠르면 INVALID_INPUT")
    void amend_ReturnBeforeDeparture() {
        assertThatThrownBy(() -> amendBookingService.amend(
                new AmendBookingCommand(null, BOOKING_ID, null, DEPART.plusDays(10), null, null)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Return date must be after departure date");
    }
}
