package personal.rezzy.reservation.booking.application.port.in;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.domain.model.ReservationChanges;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Update Reservation Command (부분 수정)
 *
 * @param tableIds null이면 기존 배정 유지, 값이 있으면 전체 교체
 */
public record UpdateReservationCommand(
        UUID reservationId,
        ReservationChanges changes,
        List<UUID> tableIds
) {
    public UpdateReservationCommand {
        if (reservationId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation ID cannot be null");
        }
        if (changes == null) {
            changes = new ReservationChanges(null, null, null, null, null, null);
        }
        if (changes.isEmpty() && tableIds == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "No fields to update");
        }
        if (tableIds != null) {
            if (tableIds.isEmpty()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "At least one table must be assigned");
            }
            if (tableIds.stream().anyMatch(Objects::isNull)) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
            }
            tableIds = List.copyOf(tableIds);
        }
    }

    public boolean reassignsTables() {
        return tableIds != null;
    }

    public Set<UUID> distinctTableIds() {
        return tableIds == null ? Set.of() : new LinkedHashSet<>(tableIds);
    }
}
