package personal.rezzy.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.rezzy.reservation.booking.application.port.in.AvailabilityQuery;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 가용 테이블 조회 요청 DTO
 */
public record AvailabilityRequest(
        @NotNull(message = "인원은 필수입니다.")
        @Positive(message = "인원은 1명 이상이어야 합니다.")
        Integer partySize,

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate reservationDate,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @Positive(message = "소요 시간은 양수여야 합니다.")
        Integer durationMinutes
) {
    public AvailabilityQuery toQuery() {
        return new AvailabilityQuery(partySize, reservationDate, startTime, durationMinutes);
    }
}
