package personal.rezzy.reservation.hours.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.rezzy.reservation.hours.domain.model.OperatingHours;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * 요일 영업시간 JPA Entity
 */
@Entity
@Table(name = "restaurant_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_restaurant_hours_day",
                columnNames = {"day_of_week"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OperatingHoursEntity {

    @Id
    private UUID id;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "open_time", nullable = false)
    private LocalTime openTime;

    @Column(name = "close_time", nullable = false)
    private LocalTime closeTime;

    @Column(name = "last_reservation_time", nullable = false)
    private LocalTime lastReservationTime;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static OperatingHoursEntity fromDomain(OperatingHours hours) {
        OperatingHoursEntity entity = new OperatingHoursEntity();
        entity.id = hours.id();
        entity.dayOfWeek = hours.dayOfWeek();
        entity.openTime = hours.openTime();
        entity.closeTime = hours.closeTime();
        entity.lastReservationTime = hours.lastReservationTime();
        return entity;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }

    public OperatingHours toDomain() {
        return new OperatingHours(id, dayOfWeek, openTime, closeTime, lastReservationTime);
    }
}
