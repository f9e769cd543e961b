package personal.rezzy.reservation.booking.adapter.in.web.dto;

import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.UUID;

/**
 * 예약에 배정된 테이블 요약
 */
public record AssignedTableResponse(
        UUID id,
        String tableNumber,
        int minCapacity,
        int maxCapacity,
        boolean shared,
        String location
) {
    public static AssignedTableResponse from(DiningTable table) {
        return new AssignedTableResponse(
                table.id(),
                table.tableNumber(),
                table.minCapacity(),
                table.maxCapacity(),
                table.shared(),
                table.location()
        );
    }
}
