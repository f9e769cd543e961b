package personal.rezzy.reservation.booking.adapter.in.web.dto;

import personal.rezzy.reservation.booking.application.port.in.AvailabilityResult;
import personal.rezzy.reservation.booking.domain.model.AvailableTable;

import java.util.List;
import java.util.UUID;

/**
 * 가용 테이블 조회 응답 DTO
 */
public record AvailabilityResponse(
        List<AvailableTableResponse> availableTables,
        boolean validTime
) {
    public static AvailabilityResponse from(AvailabilityResult result) {
        return new AvailabilityResponse(
                result.availableTables().stream()
                        .map(AvailableTableResponse::from)
                        .toList(),
                result.validTime()
        );
    }

    public record AvailableTableResponse(
            UUID id,
            String tableNumber,
            int minCapacity,
            int maxCapacity,
            boolean shared,
            String location,
            int remainingCapacity
    ) {
        public static AvailableTableResponse from(AvailableTable available) {
            return new AvailableTableResponse(
                    available.table().id(),
                    available.table().tableNumber(),
                    available.table().minCapacity(),
                    available.table().maxCapacity(),
                    available.table().shared(),
                    available.table().location(),
                    available.remainingCapacity()
            );
        }
    }
}
