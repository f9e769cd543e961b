package personal.rezzy.reservation.booking.adapter.out.persistence;

import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.booking.domain.model.TableOccupancy;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * 배정 + 예약 조인 결과 (JPQL constructor expression)
 */
public record TableOccupancyRow(
        UUID reservationId,
        UUID tableId,
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        int durationMinutes,
        ReservationStatus status) {

    public TableOccupancy toDomain() {
        return new TableOccupancy(reservationId, tableId, partySize,
                new TimeWindow(reservationDate, startTime, durationMinutes), status);
    }
}
