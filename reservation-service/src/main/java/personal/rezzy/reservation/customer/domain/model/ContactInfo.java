package personal.rezzy.reservation.customer.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

/**
 * 예약 요청에 담긴 고객 정보
 * 공백 문자열로 들어온 이메일/전화번호는 없는 것으로 취급한다.
 */
public record ContactInfo(
        String name,
        String email,
        String phone,
        String notes) {

    public ContactInfo {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer name cannot be blank");
        }
        email = blankToNull(email);
        phone = blankToNull(phone);
    }

    public boolean hasContact() {
        return email != null || phone != null;
    }

    public ContactInfo withEmail(String newEmail) {
        return new ContactInfo(name, newEmail, phone, notes);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
