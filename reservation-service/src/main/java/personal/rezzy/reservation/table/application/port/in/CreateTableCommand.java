package personal.rezzy.reservation.table.application.port.in;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

/**
 * Create Table Command
 */
public record CreateTableCommand(
        String tableNumber,
        int minCapacity,
        int maxCapacity,
        boolean shared,
        String location
) {
    public CreateTableCommand {
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
