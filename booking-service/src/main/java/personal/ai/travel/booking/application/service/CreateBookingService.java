package personal.ai.travel.booking.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CreateBookingCommand;
import personal.ai.travel.booking.application.port.in.CreateBookingUseCase;
import personal.ai.travel.booking.domain.exception.OfferUnavailableException;
import personal.ai.travel.booking.domain.model.BookingConfirmed;
import personal.ai.travel.offer.application.port.out.OfferProvider;
import personal.ai.travel.offer.domain.model.OfferValidation;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Create Booking Service (SRP)
 * 단일 책임: 예약 생성 (제공자 검증 → BookingConfirmed append → 반영)
 */
@Slf4j
@Service
public class CreateBookingService implements CreateBookingUseCase {

    private final OfferProvider offerProvider;
    private final BookingCommandExecutor commandExecutor;
    private final Clock clock;
    private final String defaultCurrency;

    public CreateBookingService(OfferProvider offerProvider,
                                BookingCommandExecutor commandExecutor,
                                Clock clock,
                                @Value("${booking.currency:EUR}") String defaultCurrency) {
        this.offerProvider = offerProvider;
        this.commandExecutor = commandExecutor;
        this.clock = clock;
        this.defaultCurrency = defaultCurrency;
    }

    @Override
    public BookingCommandResult create(CreateBookingCommand command) {
        log.info("Create booking requested: offerId={}, userId={}, type={}, passengers={}, commandId={}",
                command.offerId(), command.userId(), command.bookingType(), command.passengers(), command.commandId());

        if (command.departDate().isBefore(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure date cannot be in the past");
        }

        String aggregateId = deriveId("booking-aggregate:", command.commandId());
        String bookingId = deriveId("booking:", command.commandId());

        Optional<BookingCommandResult> previous =
                commandExecutor.replayIfProcessed(aggregateId, bookingId, command.commandId());
        if (previous.isPresent()) {
            return previous.get();
        }

        OfferValidation validation = offerProvider.validateOffer(command.offerId());
        if (!validation.valid()) {
            log.warn("Offer rejected by provider: offerId={}", command.offerId());
            throw new OfferUnavailableException(command.offerId(), "offer is no longer valid");
        }
        if (!validation.canAccommodate(command.passengers())) {
            log.warn("Offer capacity exceeded: offerId={}, capacity={}, passengers={}",
                    command.offerId(), validation.capacity(), command.passengers());
            throw new OfferUnavailableException(command.offerId(),
                    String.format("capacity %d < passengers %d", validation.capacity(), command.passengers()));
        }

        BookingConfirmed event = new BookingConfirmed(
                bookingId,
                command.bookingType(),
                command.offerId(),
                command.userId(),
                command.departure(),
                command.destination(),
                command.departDate(),
                command.returnDate(),
                command.hotelName(),
                command.passengers(),
                validation.price(),
                validation.currency() != null ? validation.currency() : defaultCurrency);

        BookingCommandResult result = commandExecutor.execute(aggregateId, bookingId, 0, command.commandId(), event);
        log.info("Booking created: bookingId={}, aggregateId={}, outcome={}",
                bookingId, aggregateId, result.outcome());
        return result;
    }

    /**
     * commandId가 있으면 결정적 ID (재전송된 생성 커맨드가 같은 스트림으로 수렴)
     */
    private String deriveId(String namespace, String commandId) {
        if (commandId == null) {
            return UUID.randomUUID().toString();
        }
        return UUID.nameUUIDFromBytes((namespace + commandId).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
