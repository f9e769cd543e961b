package personal.rezzy.reservation.booking.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.UUID;

/**
 * 예약 목록 조회 조건 (null 필드는 무시)
 */
public record ReservationFilter(
        LocalDate dateFrom,
        LocalDate dateTo,
        UUID tableId,
        ReservationStatus status,
        UUID customerId,
        int limit,
        int offset) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    public ReservationFilter {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "offset must not be negative");
        }
        if (dateFrom != null && dateTo != null && dateTo.isBefore(dateFrom)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "date_to must not be before date_from");
        }
    }
}
