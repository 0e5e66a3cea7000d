package personal.ai.travel.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.travel.booking.adapter.in.web.dto.AmendBookingRequest;
import personal.ai.travel.booking.adapter.in.web.dto.BookingCommandResponse;
import personal.ai.travel.booking.adapter.in.web.dto.BookingResponse;
import personal.ai.travel.booking.adapter.in.web.dto.CancelBookingRequest;
import personal.ai.travel.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.ai.travel.booking.application.port.in.AmendBookingUseCase;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;
import personal.ai.travel.booking.application.port.in.CancelBookingUseCase;
import personal.ai.travel.booking.application.port.in.CreateBookingUseCase;
import personal.ai.travel.booking.application.port.in.GetBookingUseCase;

import java.util.List;

/**
 * Booking API Controller
 * 예약 생성/변경/취소 커맨드와 조회 모델 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BookingController {

    static final String COMMAND_ID_HEADER = "X-Command-Id";
    static final String USER_ID_HEADER = "X-User-Id";

    private final CreateBookingUseCase createBookingUseCase;
    private final AmendBookingUseCase amendBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;

    /**
     * 예약 생성
     * POST /api/v1/bookings
     */
    @PostMapping("/bookings")
    public ResponseEntity<ApiResponse<BookingCommandResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) Long userId,
            @RequestHeader(value = COMMAND_ID_HEADER, required = false) String commandId
    ) {
        log.info("Create booking: userId={}, offerId={}, commandId={}", userId, request.offerId(), commandId);

        BookingCommandResult result = createBookingUseCase.create(request.toCommand(commandId, userId));

        return BookingCommandResponses.toResponse(result, HttpStatus.CREATED, "Booking confirmed");
    }

    /**
     * 예약 변경
     * POST /api/v1/bookings/{bookingId}/amend
     */
    @PostMapping("/bookings/{bookingId}/amend")
    public ResponseEntity<ApiResponse<BookingCommandResponse>> amendBooking(
            @PathVariable String bookingId,
            @Valid @RequestBody AmendBookingRequest request,
            @RequestHeader(value = COMMAND_ID_HEADER, required = false) String commandId
    ) {
        log.info("Amend booking: bookingId={}, commandId={}", bookingId, commandId);

        BookingCommandResult result = amendBookingUseCase.amend(request.toCommand(commandId, bookingId));

        return BookingCommandResponses.toResponse(result, HttpStatus.OK, "Booking amended");
    }

    /**
     * 예약 취소
     * POST /api/v1/bookings/{bookingId}/cancel
     */
    @PostMapping("/bookings/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<BookingCommandResponse>> cancelBooking(
            @PathVariable String bookingId,
            @Valid @RequestBody(required = false) CancelBookingRequest request,
            @RequestHeader(value = COMMAND_ID_HEADER, required = false) String commandId
    ) {
        log.info("Cancel booking: bookingId={}, commandId={}", bookingId, commandId);

        CancelBookingRequest body = request != null ? request : new CancelBookingRequest(null, null);
        BookingCommandResult result = cancelBookingUseCase.cancel(body.toCommand(commandId, bookingId));

        return BookingCommandResponses.toResponse(result, HttpStatus.OK, "Booking cancelled");
    }

    /**
     * 예약 조회 (조회 모델)
     * GET /api/v1/bookings/{bookingId}
     */
    @GetMapping("/bookings/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(@PathVariable String bookingId) {
        log.debug("Get booking: bookingId={}", bookingId);

        BookingResponse response = BookingResponse.from(getBookingUseCase.getBooking(bookingId));

        return ResponseEntity.ok(ApiResponse.success("Booking found", response));
    }

    /**
     * 사용자 예약 목록
     * GET /api/v1/users/{userId}/bookings
     */
    @GetMapping("/users/{userId}/bookings")
    public ResponseEntity<ApiResponse<List<BookingResponse>>> getUserBookings(@PathVariable Long userId) {
        log.debug("Get user bookings: userId={}", userId);

        List<BookingResponse> response = getBookingUseCase.getUserBookings(userId).stream()
                .map(BookingResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Bookings found: " + response.size(), response));
    }
}
