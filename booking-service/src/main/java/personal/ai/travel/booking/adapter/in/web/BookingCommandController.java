package personal.ai.travel.booking.adapter.in.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.adapter.in.web.dto.AmendBookingRequest;
import personal.ai.travel.booking.adapter.in.web.dto.BookingCommandResponse;
import personal.ai.travel.booking.adapter.in.web.dto.CancelBookingRequest;
import personal.ai.travel.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.ai.travel.booking.adapter.in.web.dto.SubmitCommandRequest;
import personal.ai.travel.booking.application.port.in.BookingCommand;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CommandKind;
import personal.ai.travel.booking.application.port.in.SubmitBookingCommandUseCase;

/**
 * Booking Command API Controller
 * 범용 커맨드 진입점: {kind, payload}
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BookingCommandController {

    private final SubmitBookingCommandUseCase submitBookingCommandUseCase;
    private final ObjectMapper objectMapper;

    /**
     * 커맨드 제출
     * POST /api/v1/commands
     */
    @PostMapping("/commands")
    public ResponseEntity<ApiResponse<BookingCommandResponse>> submitCommand(
            @Valid @RequestBody SubmitCommandRequest request
    ) {
        log.info("Submit command: kind={}, bookingId={}, commandId={}",
                request.kind(), request.bookingId(), request.commandId());

        BookingCommandResult result = submitBookingCommandUseCase.submit(toCommand(request));

        HttpStatus completedStatus = request.kind() == CommandKind.BOOK ? HttpStatus.CREATED : HttpStatus.OK;
        return BookingCommandResponses.toResponse(result, completedStatus, "Command " + request.kind() + " completed");
    }

    private BookingCommand toCommand(SubmitCommandRequest request) {
        try {
            return switch (request.kind()) {
                case BOOK -> objectMapper.treeToValue(request.payload(), CreateBookingRequest.class)
                        .toCommand(request.commandId(), request.userId());
                case AMEND -> objectMapper.treeToValue(request.payload(), AmendBookingRequest.class)
                        .toCommand(request.commandId(), request.bookingId());
                case CANCEL -> objectMapper.treeToValue(request.payload(), CancelBookingRequest.class)
                        .toCommand(request.commandId(), request.bookingId());
            };
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Malformed " + request.kind() + " payload: " + e.getOriginalMessage(), e);
        }
    }
}
