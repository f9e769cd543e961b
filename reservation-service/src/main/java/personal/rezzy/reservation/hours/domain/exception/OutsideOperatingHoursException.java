package personal.rezzy.reservation.hours.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.hours.domain.model.EffectiveHours;

/**
 * 예약 시간이 영업시간 밖일 때 발생하는 예외
 */
public class OutsideOperatingHoursException extends BusinessException {
    public OutsideOperatingHoursException(TimeWindow window, EffectiveHours hours) {
        super(ErrorCode.OUTSIDE_OPERATING_HOURS, hours.open()
                ? String.format("Reservation time is outside restaurant operating hours: "
                                + "date=%s, start=%s, duration=%d, open=%s, lastReservation=%s, close=%s",
                        window.date(), window.startTime(), window.durationMinutes(),
                        hours.openTime(), hours.lastReservationTime(), hours.closeTime())
                : String.format("Restaurant is closed: date=%s, source=%s", window.date(), hours.source()));
    }
}
