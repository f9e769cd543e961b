package personal.rezzy.reservation.table.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.rezzy.reservation.table.application.port.in.CreateTableCommand;
import personal.rezzy.reservation.table.application.port.in.UpdateTableCommand;

import java.util.UUID;

/**
 * 테이블 생성/수정 요청 DTO
 */
public record TableRequest(
        @NotBlank(message = "테이블 번호는 필수입니다.")
        @Size(max = 10, message = "테이블 번호는 10자 이하여야 합니다.")
        String tableNumber,

        @NotNull(message = "최소 인원은 필수입니다.")
        @Positive(message = "최소 인원은 1명 이상이어야 합니다.")
        Integer minCapacity,

        @NotNull(message = "최대 인원은 필수입니다.")
        @Positive(message = "최대 인원은 1명 이상이어야 합니다.")
        Integer maxCapacity,

        Boolean shared,

        @Size(max = 50, message = "위치는 50자 이하여야 합니다.")
        String location
) {
    public CreateTableCommand toCreateCommand() {
        return new CreateTableCommand(tableNumber, minCapacity, maxCapacity, isShared(), location);
    }

    public UpdateTableCommand toUpdateCommand(UUID tableId) {
        return new UpdateTableCommand(tableId, tableNumber, minCapacity, maxCapacity, isShared(), location);
    }

    private boolean isShared() {
        return Boolean.TRUE.equals(shared);
    }
}
