package personal.ai.travel.booking.domain.model;

/**
 * Booking Event payload (sealed)
 */
public sealed interface BookingEvent permits BookingConfirmed, BookingAmended, BookingCancelled {

    BookingEventType type();
}
