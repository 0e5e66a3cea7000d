package personal.ai.travel.booking.adapter.in.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import personal.ai.common.dto.ApiResponse;
import personal.ai.travel.booking.adapter.in.web.dto.BookingCommandResponse;
import personal.ai.travel.booking.application.port.in.BookingCommandResult;

/**
 * 커맨드 결과 → HTTP 응답 변환
 * 반영 대기(PROJECTION_PENDING)는 202 Accepted로 완전 성공과 구분한다
 */
final class BookingCommandResponses {

    private BookingCommandResponses() {
    }

    static ResponseEntity<ApiResponse<BookingCommandResponse>> toResponse(BookingCommandResult result,
                                                                         HttpStatus completedStatus,
                                                                         String completedMessage) {
        BookingCommandResponse body = BookingCommandResponse.from(result);
        if (result.isCompleted()) {
            return ResponseEntity.status(completedStatus).body(ApiResponse.success(completedMessage, body));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted("Event recorded, read model update pending", body));
    }
}
