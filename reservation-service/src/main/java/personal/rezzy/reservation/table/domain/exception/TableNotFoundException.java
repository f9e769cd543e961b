package personal.rezzy.reservation.table.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Table Not Found Exception
 */
public class TableNotFoundException extends BusinessException {
    public TableNotFoundException(UUID tableId) {
        super(ErrorCode.TABLE_NOT_FOUND, String.format("Table not found: tableId=%s", tableId));
    }
}
