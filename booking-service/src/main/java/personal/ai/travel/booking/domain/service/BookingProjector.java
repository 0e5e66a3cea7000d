package personal.ai.travel.booking.domain.service;

import org.springframework.stereotype.Component;
import personal.ai.travel.booking.domain.exception.InvalidStateTransitionException;
import personal.ai.travel.booking.domain.exception.ProjectionException;
import personal.ai.travel.booking.domain.model.Booking;
import personal.ai.travel.booking.domain.model.BookingAmended;
import personal.ai.travel.booking.domain.model.BookingCancelled;
import personal.ai.travel.booking.domain.model.BookingConfirmed;
import personal.ai.travel.booking.domain.model.BookingEventEnvelope;

import java.util.List;

/**
 * Booking Projector (Domain Service)
 * 이벤트를 조회 모델에 접는(fold) 순수 함수. 저장소에 의존하지 않는다
 *
 * - 같은 이벤트 순서를 접으면 항상 같은 결과 (증분 반영 == 전체 재생)
 * - version <= lastVersion 인 이벤트는 무시 (멱등)
 * - 버전 공백, 행 없는 변경 이벤트, 종료 상태 이후 이벤트는 ProjectionException
 */
@Component
public class BookingProjector {

    /**
     * 이벤트 하나를 현재 행에 반영
     *
     * @param current  현재 행 (없으면 null)
     * @param envelope 디코딩된 이벤트
     * @return 반영된 행 (이미 반영된 이벤트면 current 그대로)
     */
    public Booking project(Booking current, BookingEventEnvelope envelope) {
        long lastVersion = current == null ? 0 : current.lastVersion();
        if (envelope.version() <= lastVersion) {
            return current;
        }
        if (envelope.version() != lastVersion + 1) {
            throw new ProjectionException(envelope.aggregateId(), envelope.version(),
                    "version gap, expected " + (lastVersion + 1));
        }

        try {
            return switch (envelope.type()) {
                case BOOKING_CONFIRMED -> {
                    if (current != null) {
                        throw new ProjectionException(envelope.aggregateId(), envelope.version(),
                                "creation event on an existing row");
                    }
                    yield Booking.confirmed(envelope, (BookingConfirmed) envelope.event());
                }
                case BOOKING_AMENDED -> requireRow(current, envelope).amend(envelope, (BookingAmended) envelope.event());
                case BOOKING_CANCELLED ->
                        requireRow(current, envelope).cancel(envelope, (BookingCancelled) envelope.event());
            };
        } catch (InvalidStateTransitionException e) {
            throw new ProjectionException(envelope.aggregateId(), envelope.version(), e);
        }
    }

    /**
     * 스트림 전체를 처음부터 접기
     *
     * @return 마지막 이벤트까지 반영된 행 (이벤트가 없으면 null)
     */
    public Booking fold(List<BookingEventEnvelope> envelopes) {
        Booking booking = null;
        for (BookingEventEnvelope envelope : envelopes) {
            booking = project(booking, envelope);
        }
        return booking;
    }

    private Booking requireRow(Booking current, BookingEventEnvelope envelope) {
        if (current == null) {
            throw new ProjectionException(envelope.aggregateId(), envelope.version(),
                    envelope.type().eventName() + " without a created booking");
        }
        return current;
    }
}
