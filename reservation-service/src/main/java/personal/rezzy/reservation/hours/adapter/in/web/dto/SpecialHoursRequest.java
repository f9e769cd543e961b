package personal.rezzy.reservation.hours.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.rezzy.reservation.hours.application.port.in.SetSpecialHoursCommand;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특별 영업시간 요청 DTO
 * closed=false이면 세 시간 값이 모두 필요하다 (도메인에서 검증).
 */
public record SpecialHoursRequest(
        @NotNull(message = "날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "이름은 필수입니다.")
        @Size(max = 100, message = "이름은 100자 이하여야 합니다.")
        String name,

        String description,

        Boolean closed,

        LocalTime openTime,

        LocalTime closeTime,

        LocalTime lastReservationTime
) {
    public SetSpecialHoursCommand toCommand() {
        return new SetSpecialHoursCommand(date, name, description, Boolean.TRUE.equals(closed),
                openTime, closeTime, lastReservationTime);
    }
}
