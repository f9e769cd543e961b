package personal.rezzy.reservation.booking.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;

import java.util.Collection;
import java.util.UUID;

/**
 * Table Not Available Exception
 * 요청한 테이블 중 일부가 해당 시간에 인원 범위를 벗어나거나 이미 예약된 경우
 */
public class TableNotAvailableException extends BusinessException {
    public TableNotAvailableException(Collection<UUID> tableIds, int partySize, TimeWindow window) {
        super(ErrorCode.TABLE_NOT_AVAILABLE, String.format(
                "Tables not available: tableIds=%s, partySize=%d, date=%s, start=%s, duration=%d",
                tableIds, partySize, window.date(), window.startTime(), window.durationMinutes()));
    }
}
