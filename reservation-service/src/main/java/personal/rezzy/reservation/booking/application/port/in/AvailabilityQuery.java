package personal.rezzy.reservation.booking.application.port.in;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 가용 테이블 조회 조건
 *
 * @param durationMinutes null이면 설정된 기본 소요 시간
 */
public record AvailabilityQuery(
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        Integer durationMinutes
) {
    public AvailabilityQuery {
        if (partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "party_size must be positive");
        }
    }

    public TimeWindow window(int defaultDurationMinutes) {
        return new TimeWindow(reservationDate, startTime,
                durationMinutes != null ? durationMinutes : defaultDurationMinutes);
    }
}
