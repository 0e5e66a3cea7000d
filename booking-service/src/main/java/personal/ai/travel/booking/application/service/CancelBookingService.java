package personal.ai.travel.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CancelBookingCommand;
import personal.ai.travel.booking.application.port.in.CancelBookingUseCase;
import personal.ai.travel.booking.application.port.out.BookingReadModelRepository;
import personal.ai.travel.booking.domain.exception.BookingNotFoundException;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingCancelled;
import personal.ai.travel.booking.domain.service.RefundPolicy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Cancel Booking Service (SRP)
 * 단일 책임: 예약 취소 (CONFIRMED → CANCELLED, 환불액 산정)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CancelBookingService implements CancelBookingUseCase {

    private final BookingReadModelRepository bookingReadModelRepository;
    private final BookingCommandExecutor commandExecutor;
    private final RefundPolicy refundPolicy;
    private final Clock clock;

    @Override
    public BookingCommandResult cancel(CancelBookingCommand command) {
        log.info("Cancel booking requested: bookingId={}, expectedVersion={}, commandId={}",
                command.bookingId(), command.expectedVersion(), command.commandId());

        Booking booking = bookingReadModelRepository.findByBookingId(command.bookingId())
                .orElseThrow(() -> {
                    log.warn("Booking not found for cancellation: bookingId={}", command.bookingId());
                    return new BookingNotFoundException(command.bookingId());
                });

        Optional<BookingCommandResult> previous =
                commandExecutor.replayIfProcessed(booking.aggregateId(), booking.bookingId(), command.commandId());
        if (previous.isPresent()) {
            return previous.get();
        }

        booking.ensureNotStale(command.expectedVersion());
        booking.ensureConfirmed("cancel");

        BigDecimal refund = refundPolicy.refundFor(booking, LocalDate.now(clock));
        BookingCancelled event = new BookingCancelled(command.reason(), refund);

        long expectedVersion = command.expectedVersion() != null ? command.expectedVersion() : booking.lastVersion();
        BookingCommandResult result = commandExecutor.execute(booking.aggregateId(), booking.bookingId(),
                expectedVersion, command.commandId(), event);

        log.info("Booking cancelled: bookingId={}, version={}, refund={}, outcome={}",
                booking.bookingId(), result.version(), refund, result.outcome());
        return result;
    }
}
