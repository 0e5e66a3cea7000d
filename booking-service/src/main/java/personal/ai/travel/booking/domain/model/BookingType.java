package personal.ai.travel.booking.domain.model;

/**
 * 예약 상품 유형
 */
public enum BookingType {
    FLIGHT,
    HOTEL,
    PACKAGE,
    ACTIVITY;

    /**
     * 숙소 정보가 필요한 유형인지 여부
     */
    public boolean requiresHotel() {
        return this == HOTEL || this == PACKAGE;
    }
}
