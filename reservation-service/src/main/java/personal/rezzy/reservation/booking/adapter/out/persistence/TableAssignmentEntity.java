package personal.rezzy.reservation.booking.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Table Assignment JPA Entity
 * (reservation_id, table_id) 유니크 인덱스가 같은 예약에 같은 테이블이 두 번 배정되는 것을 막는다.
 */
@Entity
@Table(name = "table_assignments",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_table_assignments_reservation_table",
                columnNames = {"reservation_id", "table_id"}
        ),
        indexes = @Index(name = "idx_table_assignments_table", columnList = "table_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TableAssignmentEntity {

    @Id
    private UUID id;

    @Column(name = "reservation_id", nullable = false)
    private UUID reservationId;

    @Column(name = "table_id", nullable = false)
    private UUID tableId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static TableAssignmentEntity of(UUID reservationId, UUID tableId) {
        TableAssignmentEntity entity = new TableAssignmentEntity();
        entity.id = UUID.randomUUID();
        entity.reservationId = reservationId;
        entity.tableId = tableId;
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
