package personal.rezzy.reservation.booking.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 예약 부분 수정 항목. null 필드는 변경하지 않는다.
 */
public record ReservationChanges(
        Integer partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        Integer durationMinutes,
        String notes,
        ReservationStatus status) {

    public ReservationChanges {
        if (partySize != null && partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "party_size must be positive");
        }
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "duration_minutes must be positive");
        }
    }

    public boolean isEmpty() {
        return partySize == null && reservationDate == null && startTime == null
                && durationMinutes == null && notes == null && status == null;
    }

    /**
     * 날짜, 시작 시각, 소요 시간 중 하나라도 바뀌는지
     */
    public boolean changesWindow() {
        return reservationDate != null || startTime != null || durationMinutes != null;
    }
}
