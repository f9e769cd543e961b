package personal.rezzy.reservation.booking.domain.model;

import java.util.UUID;

/**
 * 테이블 하나에 배정된 예약 하나의 점유 정보
 */
public record TableOccupancy(
        UUID reservationId,
        UUID tableId,
        int partySize,
        TimeWindow window,
        ReservationStatus status) {
}
