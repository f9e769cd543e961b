package personal.rezzy.reservation.hours.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.rezzy.reservation.hours.application.port.in.SetOperatingHoursCommand;

import java.time.LocalTime;

/**
 * 요일 영업시간 요청 DTO
 */
public record OperatingHoursRequest(
        @NotNull(message = "요일은 필수입니다.")
        @Min(value = 0, message = "요일은 0(월요일)~6(일요일) 사이여야 합니다.")
        @Max(value = 6, message = "요일은 0(월요일)~6(일요일) 사이여야 합니다.")
        Integer dayOfWeek,

        @NotNull(message = "오픈 시간은 필수입니다.")
        LocalTime openTime,

        @NotNull(message = "마감 시간은 필수입니다.")
        LocalTime closeTime,

        @NotNull(message = "마지막 예약 시간은 필수입니다.")
        LocalTime lastReservationTime
) {
    public SetOperatingHoursCommand toCommand() {
        return new SetOperatingHoursCommand(dayOfWeek, openTime, closeTime, lastReservationTime);
    }
}
