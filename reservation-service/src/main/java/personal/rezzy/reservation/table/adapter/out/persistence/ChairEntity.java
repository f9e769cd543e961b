package personal.rezzy.reservation.table.adapter.out.persistence;

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
import personal.rezzy.reservation.table.domain.model.Chair;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Chair JPA Entity
 */
@Entity
@Table(name = "chairs",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_chairs_table_position",
                columnNames = {"table_id", "position"}
        ),
        indexes = @Index(name = "idx_chairs_table", columnList = "table_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChairEntity {

    @Id
    private UUID id;

    @Column(name = "table_id", nullable = false)
    private UUID tableId;

    @Column(nullable = false)
    private int position;

    @Column(name = "is_assigned", nullable = false)
    private boolean assigned;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static ChairEntity fromDomain(Chair chair) {
        ChairEntity entity = new ChairEntity();
        entity.id = chair.id();
        entity.tableId = chair.tableId();
        entity.position = chair.position();
        entity.assigned = chair.assigned();
        entity.createdAt = chair.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Chair toDomain() {
        return new Chair(id, tableId, position, assigned, createdAt);
    }
}
