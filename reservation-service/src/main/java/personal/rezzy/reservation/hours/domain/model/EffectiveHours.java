package personal.rezzy.reservation.hours.domain.model;

import personal.rezzy.reservation.booking.domain.model.TimeWindow;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특정 날짜에 실제로 적용되는 영업시간
 * 휴무일이면 open=false이고 시간 필드는 null이다.
 */
public record EffectiveHours(
        LocalDate date,
        boolean open,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime,
        HoursSource source) {

    public static EffectiveHours closed(LocalDate date, HoursSource source) {
        return new EffectiveHours(date, false, null, null, null, source);
    }

    public static EffectiveHours of(SpecialHours special) {
        if (special.closed()) {
            return closed(special.date(), HoursSource.SPECIAL);
        }
        return new EffectiveHours(special.date(), true, special.openTime(), special.closeTime(),
                special.lastReservationTime(), HoursSource.SPECIAL);
    }

    public static EffectiveHours of(LocalDate date, OperatingHours regular) {
        return new EffectiveHours(date, true, regular.openTime(), regular.closeTime(),
                regular.lastReservationTime(), HoursSource.REGULAR);
    }

    /**
     * 예약 시간 유효성: start >= open, start <= lastReservation, end <= close
     * 끝 시각이 다음 날로 넘어가면 유효하지 않다.
     */
    public boolean admits(TimeWindow window) {
        if (!open || !date.equals(window.date())) {
            return false;
        }
        LocalTime start = window.startTime();
        return !start.isBefore(openTime)
                && !start.isAfter(lastReservationTime)
                && !window.end().isAfter(date.atTime(closeTime));
    }
}
