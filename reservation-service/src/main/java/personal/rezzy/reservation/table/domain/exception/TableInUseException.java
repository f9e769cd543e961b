package personal.rezzy.reservation.table.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.util.UUID;

/**
 * 진행 중인 예약(pending, confirmed, seated)이 걸린 테이블 삭제,
 * 또는 기존 예약을 깨는 테이블 설정 변경 시도
 */
public class TableInUseException extends BusinessException {
    public TableInUseException(UUID tableId) {
        super(ErrorCode.TABLE_IN_USE,
                String.format("Table has active reservations and cannot be deleted: tableId=%s", tableId));
    }

    public TableInUseException(UUID tableId, String reason) {
        super(ErrorCode.TABLE_IN_USE,
                String.format("Table settings conflict with booked reservations: tableId=%s, %s", tableId, reason));
    }
}
