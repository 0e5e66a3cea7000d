package personal.ai.travel.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.travel.booking.application.port.in.GetBookingUseCase;
import personal.ai.travel.booking.application.port.out.BookingReadModelRepository;
import personal.ai.travel.booking.domain.exception.BookingNotFoundException;
import personal.ai.travel.booking.domain.model.Booking;

import java.util.List;

/**
 * Booking Query Service (SRP)
 * 단일 책임: 조회 모델 읽기 (이벤트 로그는 읽지 않음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService implements GetBookingUseCase {

    private final BookingReadModelRepository bookingReadModelRepository;

    @Override
    public Booking getBooking(String bookingId) {
        return bookingReadModelRepository.findByBookingId(bookingId)
                .orElseThrow(() -> {
                    log.debug("Booking not found: bookingId={}", bookingId);
                    return new BookingNotFoundException(bookingId);
                });
    }

    @Override
    public List<Booking> getUserBookings(Long userId) {
        return bookingReadModelRepository.findByUserId(userId);
    }
}
