package personal.rezzy.reservation.hours.adapter.in.web.dto;

import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * 특별 영업시간 응답 DTO
 */
public record SpecialHoursResponse(
        UUID id,
        LocalDate date,
        String name,
        String description,
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static SpecialHoursResponse from(SpecialHours specialHours) {
        return new SpecialHoursResponse(
                specialHours.id(),
                specialHours.date(),
                specialHours.name(),
                specialHours.description(),
                specialHours.closed(),
                specialHours.openTime(),
                specialHours.closeTime(),
                specialHours.lastReservationTime(),
                specialHours.createdAt(),
                specialHours.updatedAt()
        );
    }
}
