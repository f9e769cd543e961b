package personal.rezzy.reservation.booking.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 예약 시간 구간 [start, start + duration)
 * <p>
 * 끝 시각은 LocalDateTime으로 계산하므로 자정을 넘기면 다음 날짜가 된다.
 * 영업시간 검사({@code EffectiveHours#admits})가 같은 날짜 안에서 끝나는 구간만 허용한다.
 */
public record TimeWindow(
        LocalDate date,
        LocalTime startTime,
        int durationMinutes) {

    public TimeWindow {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation date cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "duration_minutes must be positive");
        }
    }

    public LocalDateTime start() {
        return date.atTime(startTime);
    }

    public LocalDateTime end() {
        return start().plusMinutes(durationMinutes);
    }

    /**
     * 반개구간 겹침 판정: a.start < b.end && b.start < a.end
     * 한 예약이 끝나는 시각에 다른 예약이 시작하면 겹치지 않는다.
     */
    public boolean overlaps(TimeWindow other) {
        return start().isBefore(other.end()) && other.start().isBefore(end());
    }

    public TimeWindow withChanges(LocalDate newDate, LocalTime newStartTime, Integer newDurationMinutes) {
        return new TimeWindow(
                newDate != null ? newDate : date,
                newStartTime != null ? newStartTime : startTime,
                newDurationMinutes != null ? newDurationMinutes : durationMinutes);
    }
}
