package personal.rezzy.reservation.hours.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * 요일별 정규 영업시간 (0=월요일 ~ 6=일요일)
 * lastReservationTime은 영업 종료 전에 식사를 마칠 수 있는 마지막 시작 시각이다.
 */
public record OperatingHours(
        UUID id,
        int dayOfWeek,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime) {

    public OperatingHours {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Operating hours ID cannot be null");
        }
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "day_of_week must be between 0 and 6 (Monday=0, Sunday=6)");
        }
        HoursRules.requireOrdered(openTime, closeTime, lastReservationTime);
    }

    public static OperatingHours create(int dayOfWeek, LocalTime openTime, LocalTime closeTime,
                                        LocalTime lastReservationTime) {
        return new OperatingHours(UUID.randomUUID(), dayOfWeek, openTime, closeTime, lastReservationTime);
    }

    public OperatingHours update(LocalTime openTime, LocalTime closeTime, LocalTime lastReservationTime) {
        return new OperatingHours(id, dayOfWeek, openTime, closeTime, lastReservationTime);
    }

    /**
     * 날짜를 0=월요일 기준 요일 번호로 변환
     */
    public static int dayOfWeekOf(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }
}
