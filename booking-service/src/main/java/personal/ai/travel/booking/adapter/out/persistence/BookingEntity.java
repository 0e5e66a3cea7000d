package personal.ai.travel.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingStatus;
import personal.ai.travel.booking.domain.model.BookingType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Booking JPA Entity
 * 예약 조회 모델 테이블 매핑 (이벤트 반영으로만 갱신)
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(name = "uk_booking_aggregate", columnNames = {"aggregate_id"}),
        indexes = {
                @Index(name = "idx_booking_user_created", columnList = "user_id, created_at"),
                @Index(name = "idx_booking_status_updated", columnList = "status, updated_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @Column(name = "booking_id", length = 36)
    private String bookingId;

    @Column(name = "aggregate_id", nullable = false, length = 64)
    private String aggregateId;

    @Column(name = "user_id")
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "booking_type", nullable = false, length = 20)
    private BookingType bookingType;

    @Column(name = "offer_id", nullable = false, length = 100)
    private String offerId;

    @Column(nullable = false, length = 100)
    private String departure;

    @Column(nullable = false, length = 100)
    private String destination;

    @Column(name = "depart_date", nullable = false)
    private LocalDate departDate;

    @Column(name = "return_date")
    private LocalDate returnDate;

    @Column(name = "hotel_name", length = 200)
    private String hotelName;

    @Column(nullable = false)
    private int passengers;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "cancellation_reason", length = 255)
    private String cancellationReason;

    @Column(name = "refund_amount", precision = 12, scale = 2)
    private BigDecimal refundAmount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_event_id", nullable = false, length = 36)
    private String lastEventId;

    @Column(name = "last_version", nullable = false)
    private long lastVersion;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.bookingId = booking.bookingId();
        entity.aggregateId = booking.aggregateId();
        entity.userId = booking.userId();
        entity.bookingType = booking.bookingType();
        entity.offerId = booking.offerId();
        entity.departure = booking.departure();
        entity.destination = booking.destination();
        entity.departDate = booking.departDate();
        entity.returnDate = booking.returnDate();
        entity.hotelName = booking.hotelName();
        entity.passengers = booking.passengers();
        entity.price = booking.price();
        entity.currency = booking.currency();
        entity.status = booking.status();
        entity.cancellationReason = booking.cancellationReason();
        entity.refundAmount = booking.refundAmount();
        entity.createdAt = booking.createdAt();
        entity.updatedAt = booking.updatedAt();
        entity.lastEventId = booking.lastEventId();
        entity.lastVersion = booking.lastVersion();
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Booking toDomain() {
        return new Booking(bookingId, aggregateId, userId, bookingType, offerId, departure, destination,
                departDate, returnDate, hotelName, passengers, price, currency, status,
                cancellationReason, refundAmount, createdAt, updatedAt, lastEventId, lastVersion);
    }
}
