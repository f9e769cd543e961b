package personal.rezzy.reservation.booking.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변)
 */
public record Reservation(
        UUID id,
        UUID customerId,
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        int durationMinutes,
        String notes,
        ReservationStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public Reservation {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation ID cannot be null");
        }
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "party_size must be positive");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation status cannot be null");
        }
        // 날짜/시간/소요 시간 검증은 TimeWindow에 위임
        new TimeWindow(reservationDate, startTime, durationMinutes);
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     *
     * @param status null이면 PENDING
     */
    public static Reservation create(UUID customerId, int partySize, TimeWindow window,
                                     String notes, ReservationStatus status) {
        LocalDateTime now = LocalDateTime.now();
        return new Reservation(
                UUID.randomUUID(),
                customerId,
                partySize,
                window.date(),
                window.startTime(),
                window.durationMinutes(),
                notes,
                status != null ? status : ReservationStatus.PENDING,
                now,
                now);
    }

    public TimeWindow window() {
        return new TimeWindow(reservationDate, startTime, durationMinutes);
    }

    public boolean occupiesTables() {
        return status.occupiesTable();
    }

    /**
     * 부분 수정 적용. 값이 없는 필드는 기존 값을 유지한다.
     */
    public Reservation apply(ReservationChanges changes) {
        TimeWindow window = window().withChanges(
                changes.reservationDate(), changes.startTime(), changes.durationMinutes());
        return new Reservation(
                id,
                customerId,
                changes.partySize() != null ? changes.partySize() : partySize,
                window.date(),
                window.startTime(),
                window.durationMinutes(),
                changes.notes() != null ? changes.notes() : notes,
                changes.status() != null ? changes.status() : status,
                createdAt,
                LocalDateTime.now());
    }

    public Reservation changeStatus(ReservationStatus newStatus) {
        return new Reservation(id, customerId, partySize, reservationDate, startTime, durationMinutes,
                notes, newStatus, createdAt, LocalDateTime.now());
    }

    /**
     * 비활성 상태(cancelled, no_show)에서 다시 테이블을 차지하는 상태로 바뀌는지
     */
    public boolean reoccupiesWith(ReservationStatus newStatus) {
        return !status.occupiesTable() && newStatus.occupiesTable();
    }
}
