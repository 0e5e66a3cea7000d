package personal.ai.travel.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.application.port.in.AmendBookingCommand;
import personal.ai.travel.booking.application.port.in.AmendBookingUseCase;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.out.BookingReadModelRepository;
import personal.ai.travel.booking.domain.exception.BookingNotFoundException;
import personal.ai.travel.booking.domain.exception.OfferUnavailableException;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingAmended;
import personal.ai.travel.offer.application.port.out.OfferProvider;
import personal.ai.travel.offer.domain.model.OfferValidation;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Amend Booking Service (SRP)
 * 단일 책임: 확정된 예약의 날짜/인원 변경 (제공자 재검증 후 재가격)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AmendBookingService implements AmendBookingUseCase {

    private final BookingReadModelRepository bookingReadModelRepository;
    private final OfferProvider offerProvider;
    private final BookingCommandExecutor commandExecutor;
    private final Clock clock;

    @Override
    public BookingCommandResult amend(AmendBookingCommand command) {
        log.info("Amend booking requested: bookingId={}, expectedVersion={}, commandId={}",
                command.bookingId(), command.expectedVersion(), command.commandId());

        Booking booking = bookingReadModelRepository.findByBookingId(command.bookingId())
                .orElseThrow(() -> {
                    log.warn("Booking not found for amendment: bookingId={}", command.bookingId());
                    return new BookingNotFoundException(command.bookingId());
                });

        Optional<BookingCommandResult> previous =
                commandExecutor.replayIfProcessed(booking.aggregateId(), booking.bookingId(), command.commandId());
        if (previous.isPresent()) {
            return previous.get();
        }

        booking.ensureNotStale(command.expectedVersion());
        booking.ensureConfirmed("amend");

        LocalDate departDate = command.departDate() != null ? command.departDate() : booking.departDate();
        LocalDate returnDate = command.returnDate() != null ? command.returnDate() : booking.returnDate();
        int passengers = command.passengers() != null ? command.passengers() : booking.passengers();

        if (departDate.isBefore(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure date cannot be in the past");
        }
        if (returnDate != null && !returnDate.isAfter(departDate)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Return date must be after departure date");
        }

        OfferValidation validation = offerProvider.validateOffer(booking.offerId());
        int additionalSeats = Math.max(0, passengers - booking.passengers());
        if (!validation.valid() || !validation.canAccommodate(additionalSeats)) {
            log.warn("Offer cannot cover amendment: offerId={}, valid={}, capacity={}, additionalSeats={}",
                    booking.offerId(), validation.valid(), validation.capacity(), additionalSeats);
            throw new OfferUnavailableException(booking.offerId(), "cannot accommodate amendment");
        }

        BookingAmended event = new BookingAmended(
                departDate,
                returnDate,
                passengers,
                validation.price(),
                validation.currency() != null ? validation.currency() : booking.currency());

        long expectedVersion = command.expectedVersion() != null ? command.expectedVersion() : booking.lastVersion();
        BookingCommandResult result = commandExecutor.execute(booking.aggregateId(), booking.bookingId(),
                expectedVersion, command.commandId(), event);

        log.info("Booking amended: bookingId={}, version={}, outcome={}",
                booking.bookingId(), result.version(), result.outcome());
        return result;
    }
}
