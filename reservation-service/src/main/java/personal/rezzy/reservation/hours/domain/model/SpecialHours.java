package personal.rezzy.reservation.hours.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * 특정 날짜의 특별 영업시간 (휴무 또는 별도 시간대)
 * 해당 날짜에서는 요일 영업시간보다 항상 우선한다.
 */
public record SpecialHours(
        UUID id,
        LocalDate date,
        String name,
        String description,
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public static final int NAME_MAX_LENGTH = 100;

    public SpecialHours {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Special hours ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Special hours date cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Special hours name cannot be blank");
        }
        if (name.length() > NAME_MAX_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Special hours name must be at most " + NAME_MAX_LENGTH + " characters");
        }
        if (!closed) {
            HoursRules.requireOrdered(openTime, closeTime, lastReservationTime);
        }
    }

    public static SpecialHours create(LocalDate date, String name, String description, boolean closed,
                                      LocalTime openTime, LocalTime closeTime, LocalTime lastReservationTime) {
        LocalDateTime now = LocalDateTime.now();
        return new SpecialHours(UUID.randomUUID(), date, name, description, closed,
                openTime, closeTime, lastReservationTime, now, now);
    }

    public SpecialHours update(String name, String description, boolean closed,
                               LocalTime openTime, LocalTime closeTime, LocalTime lastReservationTime) {
        return new SpecialHours(id, date, name, description, closed,
                openTime, closeTime, lastReservationTime, createdAt, LocalDateTime.now());
    }
}
