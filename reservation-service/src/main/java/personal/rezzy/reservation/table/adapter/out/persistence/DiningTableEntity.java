package personal.rezzy.reservation.table.adapter.out.persistence;

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
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Dining Table JPA Entity
 */
@Entity
@Table(name = "dining_tables",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_dining_tables_number",
                columnNames = {"table_number"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DiningTableEntity {

    @Id
    private UUID id;

    @Column(name = "table_number", nullable = false, length = 10)
    private String tableNumber;

    @Column(name = "min_capacity", nullable = false)
    private int minCapacity;

    @Column(name = "max_capacity", nullable = false)
    private int maxCapacity;

    @Column(name = "is_shared", nullable = false)
    private boolean shared;

    @Column(length = 50)
    private String location;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static DiningTableEntity fromDomain(DiningTable table) {
        DiningTableEntity entity = new DiningTableEntity();
        entity.id = table.id();
        entity.tableNumber = table.tableNumber();
        entity.minCapacity = table.minCapacity();
        entity.maxCapacity = table.maxCapacity();
        entity.shared = table.shared();
        entity.location = table.location();
        entity.createdAt = table.createdAt();
        entity.updatedAt = table.updatedAt();
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

    public DiningTable toDomain() {
        return new DiningTable(id, tableNumber, minCapacity, maxCapacity, shared, location, createdAt, updatedAt);
    }
}
