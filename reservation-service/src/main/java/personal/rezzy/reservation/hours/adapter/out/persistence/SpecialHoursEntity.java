package personal.rezzy.reservation.hours.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * 특별 영업시간 JPA Entity
 */
@Entity
@Table(name = "special_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_special_hours_date",
                columnNames = {"special_date"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SpecialHoursEntity {

    @Id
    private UUID id;

    @Column(name = "special_date", nullable = false)
    private LocalDate specialDate;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Column(name = "last_reservation_time")
    private LocalTime lastReservationTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static SpecialHoursEntity fromDomain(SpecialHours specialHours) {
        SpecialHoursEntity entity = new SpecialHoursEntity();
        entity.id = specialHours.id();
        entity.specialDate = specialHours.date();
        entity.name = specialHours.name();
        entity.description = specialHours.description();
        entity.closed = specialHours.closed();
        entity.openTime = specialHours.openTime();
        entity.closeTime = specialHours.closeTime();
        entity.lastReservationTime = specialHours.lastReservationTime();
        entity.createdAt = specialHours.createdAt();
        entity.updatedAt = specialHours.updatedAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public SpecialHours toDomain() {
        return new SpecialHours(id, specialDate, name, description, closed,
                openTime, closeTime, lastReservationTime, createdAt, updatedAt);
    }
}
