package personal.rezzy.reservation.customer.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Customer Domain Model
 * 이메일 또는 전화번호 중 하나 이상을 가진 연락처 정보
 */
public record Customer(
        UUID id,
        String name,
        String email,
        String phone,
        String notes,
        LocalDateTime createdAt) {

    public Customer {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer name cannot be blank");
        }
        if (email == null && phone == null) {
            throw new BusinessException(ErrorCode.CONTACT_REQUIRED,
                    "Either email or phone must be provided: name=" + name);
        }
    }

    public static Customer register(ContactInfo contact) {
        return new Customer(UUID.randomUUID(), contact.name(), contact.email(), contact.phone(),
                contact.notes(), LocalDateTime.now());
    }
}
