package personal.rezzy.reservation.booking.domain.model;

import personal.rezzy.reservation.table.domain.model.DiningTable;

/**
 * 가용 테이블과 남은 수용 인원
 * 비공유 테이블은 비어 있을 때만 반환되므로 remainingCapacity = maxCapacity
 */
public record AvailableTable(
        DiningTable table,
        int remainingCapacity) {
}
