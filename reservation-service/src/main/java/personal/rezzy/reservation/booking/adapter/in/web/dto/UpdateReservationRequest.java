package personal.rezzy.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.rezzy.reservation.booking.application.port.in.UpdateReservationCommand;
import personal.rezzy.reservation.booking.domain.model.ReservationChanges;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * 예약 부분 수정 요청 DTO (null 필드는 변경하지 않음)
 */
public record UpdateReservationRequest(
        @Positive(message = "인원은 1명 이상이어야 합니다.")
        Integer partySize,

        LocalDate reservationDate,

        LocalTime startTime,

        @Positive(message = "소요 시간은 양수여야 합니다.")
        Integer durationMinutes,

        String notes,

        String status,

        List<@NotNull UUID> tableIds
) {
    public UpdateReservationCommand toCommand(UUID reservationId) {
        ReservationChanges changes = new ReservationChanges(
                partySize,
                reservationDate,
                startTime,
                durationMinutes,
                notes,
                status != null ? ReservationStatus.from(status) : null);
        return new UpdateReservationCommand(reservationId, changes, tableIds);
    }
}
