package personal.rezzy.reservation.hours.adapter.in.web.dto;

import personal.rezzy.reservation.hours.domain.model.OperatingHours;

import java.time.LocalTime;
import java.util.UUID;

/**
 * 요일 영업시간 응답 DTO
 */
public record OperatingHoursResponse(
        UUID id,
        int dayOfWeek,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public static OperatingHoursResponse from(OperatingHours hours) {
        return new OperatingHoursResponse(
                hours.id(),
                hours.dayOfWeek(),
                hours.openTime(),
                hours.closeTime(),
                hours.lastReservationTime()
        );
    }
}
