package personal.rezzy.reservation.booking.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.rezzy.reservation.booking.application.port.in.BookReservationCommand;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * 예약 생성 요청 DTO
 */
public record CreateReservationRequest(
        @NotNull(message = "고객 정보는 필수입니다.")
        @Valid
        CustomerRequest customer,

        @NotNull(message = "인원은 필수입니다.")
        @Positive(message = "인원은 1명 이상이어야 합니다.")
        Integer partySize,

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate reservationDate,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @Positive(message = "소요 시간은 양수여야 합니다.")
        Integer durationMinutes,

        String notes,

        String status,

        @NotEmpty(message = "테이블을 하나 이상 지정해야 합니다.")
        List<@NotNull UUID> tableIds
) {
    public BookReservationCommand toCommand() {
        return new BookReservationCommand(
                customer.toContactInfo(),
                partySize,
                reservationDate,
                startTime,
                durationMinutes,
                notes,
                status != null ? ReservationStatus.from(status) : null,
                tableIds);
    }
}
