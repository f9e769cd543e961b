package personal.rezzy.reservation.table.adapter.in.web.dto;

import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 테이블 응답 DTO
 */
public record TableResponse(
        UUID id,
        String tableNumber,
        int minCapacity,
        int maxCapacity,
        boolean shared,
        String location,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static TableResponse from(DiningTable table) {
        return new TableResponse(
                table.id(),
                table.tableNumber(),
                table.minCapacity(),
                table.maxCapacity(),
                table.shared(),
                table.location(),
                table.createdAt(),
                table.updatedAt()
        );
    }
}
