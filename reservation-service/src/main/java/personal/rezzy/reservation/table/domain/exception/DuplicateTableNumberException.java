package personal.rezzy.reservation.table.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

/**
 * 테이블 번호 중복 예외
 */
public class DuplicateTableNumberException extends BusinessException {
    public DuplicateTableNumberException(String tableNumber) {
        super(ErrorCode.DUPLICATE_TABLE_NUMBER,
                String.format("Table number already exists: tableNumber=%s", tableNumber));
    }
}
