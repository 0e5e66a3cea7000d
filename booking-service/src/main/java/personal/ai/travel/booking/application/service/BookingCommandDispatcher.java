package personal.ai.travel.booking.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import personal.ai.travel.booking.application.port.in.AmendBookingCommand;
import personal.ai.travel.booking.application.port.in.AmendBookingUseCase;
import personal.ai.travel.booking.application.port.in.BookingCommand;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CancelBookingCommand;
import personal.ai.travel.booking.application.port.in.CancelBookingUseCase;
import personal.ai.travel.booking.application.port.in.CreateBookingCommand;
import personal.ai.travel.booking.application.port.in.CreateBookingUseCase;
import personal.ai.travel.booking.application.port.in.SubmitBookingCommandUseCase;

/**
 * Booking Command Dispatcher
 * 커맨드 종류별 핸들러 위임
 */
@Service
@RequiredArgsConstructor
public class BookingCommandDispatcher implements SubmitBookingCommandUseCase {

    private final CreateBookingUseCase createBookingUseCase;
    private final AmendBookingUseCase amendBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;

    @Override
    public BookingCommandResult submit(BookingCommand command) {
        return switch (command.kind()) {
            case BOOK -> createBookingUseCase.create((CreateBookingCommand) command);
            case AMEND -> amendBookingUseCase.amend((AmendBookingCommand) command);
            case CANCEL -> cancelBookingUseCase.cancel((CancelBookingCommand) command);
        };
    }
}
