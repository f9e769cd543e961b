package personal.rezzy.reservation.booking.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_reservations_date_start", columnList = "reservation_date, start_time"),
                @Index(name = "idx_reservations_customer", columnList = "customer_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity {

    @Id
    private UUID id;

    @Column(name = "customer_id", nullable = false)
    private UUID customerId;

    @Column(name = "party_size", nullable = false)
    private int partySize;

    @Column(name = "reservation_date", nullable = false)
    private LocalDate reservationDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Convert(converter = ReservationStatusConverter.class)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.id = reservation.id();
        entity.customerId = reservation.customerId();
        entity.partySize = reservation.partySize();
        entity.reservationDate = reservation.reservationDate();
        entity.startTime = reservation.startTime();
        entity.durationMinutes = reservation.durationMinutes();
        entity.notes = reservation.notes();
        entity.status = reservation.status();
        entity.createdAt = reservation.createdAt();
        entity.updatedAt = reservation.updatedAt();
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

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * 도메인 모델로 변환
     */
    public Reservation toDomain() {
        return new Reservation(id, customerId, partySize, reservationDate, startTime, durationMinutes,
                notes, status, createdAt, updatedAt);
    }
}
