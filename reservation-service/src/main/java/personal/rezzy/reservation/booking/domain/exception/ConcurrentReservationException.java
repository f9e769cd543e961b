package personal.rezzy.reservation.booking.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.util.Collection;
import java.util.UUID;

/**
 * Concurrent Reservation Exception
 * 락을 통과했지만 DB 유니크 제약(배정, 고객 이메일/전화번호)에서 충돌이 감지된 경우
 */
public class ConcurrentReservationException extends BusinessException {
    public ConcurrentReservationException(Collection<UUID> tableIds, Throwable cause) {
        super(ErrorCode.CONCURRENT_RESERVATION,
                String.format("Concurrent reservation detected: tableIds=%s", tableIds), cause);
    }
}
