package personal.ai.travel.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import personal.ai.travel.booking.application.port.in.CreateBookingCommand;
import personal.ai.travel.booking.domain.model.BookingType;

import java.time.LocalDate;

/**
 * 예약 생성 요청 DTO
 */
public record CreateBookingRequest(
        @NotNull(message = "예약 유형은 필수입니다.")
        BookingType bookingType,

        @NotBlank(message = "상품 ID는 필수입니다.")
        String offerId,

        @NotBlank(message = "출발지는 필수입니다.")
        String departure,

        @NotBlank(message = "도착지는 필수입니다.")
        String destination,

        @NotNull(message = "출발일은 필수입니다.")
        LocalDate departDate,

        LocalDate returnDate,

        String hotelName,

        @NotNull(message = "인원은 필수입니다.")
        @Min(value = 1, message = "인원은 1명 이상이어야 합니다.")
        @Max(value = 9, message = "인원은 9명 이하여야 합니다.")
        Integer passengers
) {
    public CreateBookingCommand toCommand(String commandId, Long userId) {
        return new CreateBookingCommand(commandId, userId, bookingType, offerId, departure, destination,
                departDate, returnDate, hotelName, passengers == null ? 0 : passengers);
    }
}
