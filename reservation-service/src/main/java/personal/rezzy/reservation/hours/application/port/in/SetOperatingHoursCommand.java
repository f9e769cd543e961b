package personal.rezzy.reservation.hours.application.port.in;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalTime;

/**
 * 요일 영업시간 등록/수정 커맨드 (요일 기준 upsert)
 */
public record SetOperatingHoursCommand(
        int dayOfWeek,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public SetOperatingHoursCommand {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "day_of_week must be between 0 and 6 (Monday=0, Sunday=6)");
        }
    }
}
