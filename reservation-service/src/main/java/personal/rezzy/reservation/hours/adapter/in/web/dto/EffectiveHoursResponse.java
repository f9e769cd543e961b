package personal.rezzy.reservation.hours.adapter.in.web.dto;

import personal.rezzy.reservation.hours.domain.model.EffectiveHours;
import personal.rezzy.reservation.hours.domain.model.HoursSource;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 날짜별 적용 영업시간 응답 DTO
 */
public record EffectiveHoursResponse(
        LocalDate date,
        boolean open,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime,
        HoursSource source
) {
    public static EffectiveHoursResponse from(EffectiveHours hours) {
        return new EffectiveHoursResponse(
                hours.date(),
                hours.open(),
                hours.openTime(),
                hours.closeTime(),
                hours.lastReservationTime(),
                hours.source()
        );
    }
}
