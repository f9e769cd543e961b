package personal.rezzy.reservation.booking.application.port.in;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Book Reservation Command
 *
 * @param durationMinutes null이면 설정된 기본 소요 시간
 * @param status          null이면 pending
 * @param tableIds        배정할 테이블 (중복은 하나로 합친다)
 */
public record BookReservationCommand(
        ContactInfo customer,
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        Integer durationMinutes,
        String notes,
        ReservationStatus status,
        List<UUID> tableIds
) {
    public BookReservationCommand {
        if (customer == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer information is required");
        }
        if (partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "party_size must be positive");
        }
        if (tableIds == null || tableIds.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "At least one table must be assigned");
        }
        if (tableIds.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
        }
        tableIds = List.copyOf(tableIds);
    }

    public TimeWindow window(int defaultDurationMinutes) {
        return new TimeWindow(reservationDate, startTime,
                durationMinutes != null ? durationMinutes : defaultDurationMinutes);
    }

    public Set<UUID> distinctTableIds() {
        return new LinkedHashSet<>(tableIds);
    }
}
