package personal.ai.travel.booking.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CommandOutcome;
import personal.ai.travel.booking.application.port.in.CreateBookingCommand;
import personal.ai.travel.booking.domain.exception.OfferUnavailableException;
import personal.ai.travel.booking.domain.model.BookingConfirmed;
import personal.ai.travel.booking.domain.model.BookingEvent;
import personal.ai.travel.booking.domain.model.BookingType;
import personal.ai.travel.offer.application.port.out.OfferProvider;
import personal.ai.travel.offer.domain.exception.ProviderTimeoutException;
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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("CreateBookingService 단위 테스트")
class CreateBookingServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate DEPART = LocalDate.of(2026, 12, 1);

    @Mock
    private OfferProvider offerProvider;
    @Mock
    private BookingCommandExecutor commandExecutor;

    private CreateBookingService createBookingService;

    @BeforeEach
    void setUp() {
        createBookingService = new CreateBookingService(offerProvider, commandExecutor, CLOCK, "EUR");
    }

    private static CreateBookingCommand command(String commandId, String offerId, int passengers) {
        return new CreateBookingCommand(commandId, 1L, BookingType.FLIGHT, offerId, "TLV", "PAR",
                DEPART, DEPART.plusDays(7), null, passengers);
    }

    private static BookingCommandResult completedResult() {
        return new BookingCommandResult(CommandOutcome.COMPLETED, "bk", "agg", "evt-1", 1, null, null);
    }

    @Test
    @DisplayName("유효한 상품이면 제공자 가격으로 BookingConfirmed를 version 0 기준으로 append 한다")
    void create_Success() {
        // given
        given(offerProvider.validateOffer("OFR-1"))
                .willReturn(new OfferValidation("OFR-1", true, new BigDecimal("250"), null, 2));
        given(commandExecutor.execute(anyString(), anyString(), eq(0L), isNull(), any()))
                .willReturn(completedResult());

        // when
        BookingCommandResult result = createBookingService.create(command(null, "OFR-1", 2));

        // then
        ArgumentCaptor<BookingEvent> event = ArgumentCaptor.forClass(BookingEvent.class);
        verify(commandExecutor).execute(anyString(), anyString(), eq(0L), isNull(), event.capture());
        BookingConfirmed confirmed = (BookingConfirmed) event.getValue();
        assertThat(confirmed.price()).isEqualByComparingTo("250");
        assertThat(confirmed.currency()).isEqualTo("EUR");
        assertThat(confirmed.passengers()).isEqualTo(2);
        assertThat(result.isCompleted()).isTrue();
    }

    @Test
    @DisplayName("유효하지 않은 상품은 OfferUnavailableException, append 없음")
    void create_InvalidOffer() {
        // given
        given(offerProvider.validateOffer("SOLDOUT")).willReturn(OfferValidation.unavailable("SOLDOUT"));

        // when & then
        assertThatThrownBy(() -> createBookingService.create(command(null, "SOLDOUT", 1)))
                .isInstanceOf(OfferUnavailableException.class);
        verify(commandExecutor, never()).execute(any(), any(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("잔여 수량보다 인원이 많으면 OfferUnavailableException")
    void create_CapacityExceeded() {
        // given
        given(offerProvider.validateOffer("OFR-1"))
                .willReturn(new OfferValidation("OFR-1", true, new BigDecimal("250"), "EUR", 2));

        // when & then
        assertThatThrownBy(() -> createBookingService.create(command(null, "OFR-1", 3)))
                .isInstanceOf(OfferUnavailableException.class)
                .hasMessageContaining("capacity 2 < passengers 3");
    }

    @Test
    @DisplayName("제공자 타임아웃은 그대로 전달되고 append 하지 않는다")
    void create_ProviderTimeout() {
        // given
        given(offerProvider.validateOffer("OFR-1"))
                .willThrow(new ProviderTimeoutException("validateOffer", new RuntimeException("timeout")));

        // when & then
        assertThatThrownBy(() -> createBookingService.create(command(null, "OFR-1", 1)))
                .isInstanceOf(ProviderTimeoutException.class);
        verify(commandExecutor, never()).execute(any(), any(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("과거 출발일은 제공자 호출 없이 INVALID_INPUT")
    void create_PastDeparture() {
        // given
        CreateBookingCommand past = new CreateBookingCommand(null, 1L, BookingType.FLIGHT, "OFR-1", "TLV", "PAR",
                LocalDate.of(2026, 9, 30), null, null, 1);

        // when & then
        assertThatThrownBy(() -> createBookingService.create(past))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
        verifyNoInteractions(offerProvider, commandExecutor);
    }

    @Test
    @DisplayName("같은 commandId로 재전송된 생성은 제공자 호출 없이 기존 결과를 돌려준다")
    void create_Resubmitted() {
        // given
        BookingCommandResult previous = completedResult();
        given(commandExecutor.replayIfProcessed(anyString(), anyString(), eq("cmd-1")))
                .willReturn(Optional.of(previous));

        // when
        BookingCommandResult result = createBookingService.create(command("cmd-1", "OFR-1", 1));

        // then
        assertThat(result).isSameAs(previous);
        verifyNoInteractions(offerProvider);
    }

    @Test
    @DisplayName("commandId가 있으면 aggregate ID가 결정적으로 유도된다")
    void create_DeterministicIds() {
        // given
        given(commandExecutor.replayIfProcessed(anyString(), anyString(), eq("cmd-9"))).willReturn(Optional.empty());
        given(offerProvider.validateOffer("OFR-1"))
                .willReturn(new OfferValidation("OFR-1", true, new BigDecimal("250"), "EUR", 9));
        given(commandExecutor.execute(anyString(), anyString(), eq(0L), eq("cmd-9"), any()))
                .willReturn(completedResult());

        // when
        createBookingService.create(command("cmd-9", "OFR-1", 1));
        createBookingService.create(command("cmd-9", "OFR-1", 1));

        // then
        ArgumentCaptor<String> aggregateIds = ArgumentCaptor.forClass(String.class);
        verify(commandExecutor, times(2))
                .execute(aggregateIds.capture(), anyString(), eq(0L), eq("cmd-9"), any());
        assertThat(aggregateIds.getAllValues().get(0)).isEqualTo(aggregateIds.getAllValues().get(1));
    }
}
