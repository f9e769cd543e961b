package personal.rezzy.reservation.booking.adapter.in.web.dto;

import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.customer.domain.model.Customer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * 예약 응답 DTO
 */
public record ReservationResponse(
        UUID id,
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        int durationMinutes,
        String notes,
        ReservationStatus status,
        LocalDateTime createdAt,
        UUID customerId,
        String customerName,
        String customerEmail,
        String customerPhone,
        List<AssignedTableResponse> tables
) {
    public static ReservationResponse from(ReservationDetails details) {
        Reservation reservation = details.reservation();
        Customer customer = details.customer();
        return new ReservationResponse(
                reservation.id(),
                reservation.partySize(),
                reservation.reservationDate(),
                reservation.startTime(),
                reservation.durationMinutes(),
                reservation.notes(),
                reservation.status(),
                reservation.createdAt(),
                customer.id(),
                customer.name(),
                customer.email(),
                customer.phone(),
                details.tables().stream()
                        .map(AssignedTableResponse::from)
                        .toList()
        );
    }
}
