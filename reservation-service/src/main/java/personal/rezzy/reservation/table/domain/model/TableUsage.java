package personal.rezzy.reservation.table.domain.model;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 테이블을 차지하는 예약 하나의 시간대와 인원
 *
 * @param start 포함
 * @param end   미포함
 */
public record TableUsage(
        UUID reservationId,
        int partySize,
        LocalDateTime start,
        LocalDateTime end) {
}
