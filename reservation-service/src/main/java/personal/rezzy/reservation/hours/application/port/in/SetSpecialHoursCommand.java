package personal.rezzy.reservation.hours.application.port.in;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특별 영업시간 등록/수정 커맨드 (날짜 기준 upsert)
 */
public record SetSpecialHoursCommand(
        LocalDate date,
        String name,
        String description,
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public SetSpecialHoursCommand {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Special hours date cannot be null");
        }
    }
}
