package personal.rezzy.reservation.table.application.port.in;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Update Table Command (전체 교체)
 */
public record UpdateTableCommand(
        UUID tableId,
        String tableNumber,
        int minCapacity,
        int maxCapacity,
        boolean shared,
        String location
) {
    public UpdateTableCommand {
        if (tableId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
        }
        if (tableNumber == null || tableNumber.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table number cannot be blank");
        }
        if (minCapacity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "min_capacity must be positive");
        }
        if (maxCapacity < minCapacity) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "max_capacity must be greater than or equal to min_capacity");
        }
    }
}
