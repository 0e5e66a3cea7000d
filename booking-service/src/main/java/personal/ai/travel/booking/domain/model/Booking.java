package personal.ai.travel.booking.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.travel.booking.domain.exception.InvalidStateTransitionException;
import personal.ai.travel.eventstore.domain.exception.ConcurrencyConflictException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Booking Read Model
 * 예약 조회 모델 (불변). 모든 필드는 이벤트 payload와 메타데이터에서만 유도된다
 */
public record Booking(
        String bookingId,
        String aggregateId,
        Long userId,
        BookingType bookingType,
        String offerId,
        String departure,
        String destination,
        LocalDate departDate,
        LocalDate returnDate,
        String hotelName,
        int passengers,
        BigDecimal price,
        String currency,
        BookingStatus status,
        String cancellationReason,
        BigDecimal refundAmount,
        Instant createdAt,
        Instant updatedAt,
        String lastEventId,
        long lastVersion) {

    private static final int MONEY_SCALE = 2;

    public Booking {
        if (bookingId == null || bookingId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null or blank");
        }
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Aggregate ID cannot be null or blank");
        }
        if (bookingType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking type cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (price == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Price cannot be null");
        }
        if (lastVersion < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Last version must be positive");
        }
        // DB(DECIMAL(12,2)) 왕복 후에도 동일한 값이 되도록 스케일 고정
        price = price.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        if (refundAmount != null) {
            refundAmount = refundAmount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        }
    }

    /**
     * 예약 확정 이벤트로부터 조회 모델 생성
     */
    public static Booking confirmed(BookingEventEnvelope envelope, BookingConfirmed event) {
        return new Booking(
                event.bookingId(),
                envelope.aggregateId(),
                event.userId(),
                event.bookingType(),
                event.offerId(),
                event.departure(),
                event.destination(),
                event.departDate(),
                event.returnDate(),
                event.hotelName(),
                event.passengers(),
                event.price(),
                event.currency(),
                BookingStatus.CONFIRMED,
                null,
                null,
                envelope.timestamp(),
                envelope.timestamp(),
                envelope.eventId(),
                envelope.version());
    }

    /**
     * 예약 변경 반영 (CONFIRMED 상태에서만)
     */
    public Booking amend(BookingEventEnvelope envelope, BookingAmended event) {
        ensureConfirmed("amend");
        return new Booking(bookingId, aggregateId, userId, bookingType, offerId, departure, destination,
                event.departDate(), event.returnDate(), hotelName, event.passengers(),
                event.price(), event.currency(), status, cancellationReason, refundAmount,
                createdAt, envelope.timestamp(), envelope.eventId(), envelope.version());
    }

    /**
     * 예약 취소 반영 (CONFIRMED -> CANCELLED)
     */
    public Booking cancel(BookingEventEnvelope envelope, BookingCancelled event) {
        ensureConfirmed("cancel");
        return new Booking(bookingId, aggregateId, userId, bookingType, offerId, departure, destination,
                departDate, returnDate, hotelName, passengers, price, currency,
                BookingStatus.CANCELLED, event.reason(), event.refundAmount(),
                createdAt, envelope.timestamp(), envelope.eventId(), envelope.version());
    }

    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    public boolean isCancelled() {
        return status == BookingStatus.CANCELLED;
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * CONFIRMED 상태 검증
     *
     * @param action 요청된 동작 (로그/응답용)
     * @throws InvalidStateTransitionException CONFIRMED 상태가 아닐 때
     */
    public void ensureConfirmed(String action) {
        if (!isConfirmed()) {
            throw new InvalidStateTransitionException(bookingId, status, action);
        }
    }

    /**
     * 호출자가 알고 있는 버전이 이미 지난 버전이면 충돌
     *
     * @param expectedVersion 호출자 기대 버전 (null이면 검사하지 않음)
     * @throws ConcurrencyConflictException expectedVersion < lastVersion 일 때
     */
    public void ensureNotStale(Long expectedVersion) {
        if (expectedVersion != null && expectedVersion < lastVersion) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, lastVersion);
        }
    }
}
