package personal.rezzy.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;

/**
 * 예약자 정보
 * 이메일과 전화번호가 모두 없으면 소규모 일행에 한해 대체 이메일이 생성된다.
 */
public record CustomerRequest(
        @NotBlank(message = "고객 이름은 필수입니다.")
        @Size(max = 100, message = "고객 이름은 100자 이하여야 합니다.")
        String name,

        @Email(message = "이메일 형식이 올바르지 않습니다.")
        @Size(max = 100, message = "이메일은 100자 이하여야 합니다.")
        String email,

        @Size(max = 20, message = "전화번호는 20자 이하여야 합니다.")
        String phone,

        String notes
) {
    public ContactInfo toContactInfo() {
        return new ContactInfo(name, email, phone, notes);
    }
}
