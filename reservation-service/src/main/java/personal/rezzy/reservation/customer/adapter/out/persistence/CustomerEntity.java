package personal.rezzy.reservation.customer.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.rezzy.reservation.customer.domain.model.Customer;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Customer JPA Entity
 * email, phone 유니크 제약이 동시 등록 시 중복 고객 생성을 막는다.
 */
@Entity
@Table(name = "customers",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_customers_email", columnNames = {"email"}),
                @UniqueConstraint(name = "uk_customers_phone", columnNames = {"phone"})
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity {

    @Id
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String email;

    @Column(length = 20)
    private String phone;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static CustomerEntity fromDomain(Customer customer) {
        CustomerEntity entity = new CustomerEntity();
        entity.id = customer.id();
        entity.name = customer.name();
        entity.email = customer.email();
        entity.phone = customer.phone();
        entity.notes = customer.notes();
        entity.createdAt = customer.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Customer toDomain() {
        return new Customer(id, name, email, phone, notes, createdAt);
    }
}
