package personal.rezzy.reservation.table.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Chair Domain Model
 * 테이블 수용 인원을 표현하는 파생 레코드. position이 작을수록 먼저 만들어진 의자다.
 */
public record Chair(
        UUID id,
        UUID tableId,
        int position,
        boolean assigned,
        LocalDateTime createdAt) {

    public Chair {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Chair ID cannot be null");
        }
        if (tableId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
        }
        if (position <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Chair position must be positive");
        }
    }

    public static Chair create(UUID tableId, int position) {
        return new Chair(UUID.randomUUID(), tableId, position, true, LocalDateTime.now());
    }
}
