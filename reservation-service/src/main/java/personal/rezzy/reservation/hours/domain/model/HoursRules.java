package personal.rezzy.reservation.hours.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalTime;

/**
 * 영업시간 세 값의 순서 규칙: open < lastReservation < close
 */
final class HoursRules {

    private HoursRules() {
    }

    static void requireOrdered(LocalTime openTime, LocalTime closeTime, LocalTime lastReservationTime) {
        if (openTime == null || closeTime == null || lastReservationTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "open_time, close_time and last_reservation_time are required when open");
        }
        if (!closeTime.isAfter(openTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "close_time must be after open_time");
        }
        if (!lastReservationTime.isAfter(openTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "last_reservation_time must be after open_time");
        }
        if (!lastReservationTime.isBefore(closeTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "last_reservation_time must be before close_time");
        }
    }
}
