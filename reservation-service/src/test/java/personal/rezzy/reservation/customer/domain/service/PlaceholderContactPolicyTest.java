package personal.rezzy.reservation.customer.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.application.config.BookingProperties;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PlaceholderContactPolicy 단위 테스트")
class PlaceholderContactPolicyTest {

    private final PlaceholderContactPolicy policy =
            new PlaceholderContactPolicy(new BookingProperties(90, 6, "restaurant.local"));

    @Test
    @DisplayName("연락처가 있으면 그대로 사용한다")
    void keepsRealContact() {
        ContactInfo contact = new ContactInfo("Jane", null, "010-1234-5678", null);

        assertThat(policy.apply(contact, 8)).isSameAs(contact);
    }

    @Test
    @DisplayName("소규모 일행은 이름 기반 대체 이메일을 받는다")
    void smallPartyGetsPlaceholder() {
        // when
        ContactInfo applied = policy.apply(new ContactInfo("John Doe", "  ", null, null), 5);

        // then
        assertThat(applied.email()).matches("guest-[0-9a-f]{8}@restaurant\\.local");
        assertThat(applied.phone()).isNull();
    }

    @Test
    @DisplayName("대소문자와 앞뒤 공백이 달라도 같은 이메일을 만든다")
    void placeholderIsDeterministic() {
        assertThat(policy.placeholderEmail("  John Doe "))
                .isEqualTo(policy.placeholderEmail("john doe"))
                .isNotEqualTo(policy.placeholderEmail("Jane Doe"));
    }

    @Test
    @DisplayName("기준 인원 이상인 일행은 연락처가 필요하다")
    void largePartyRequiresContact() {
        assertThatThrownBy(() -> policy.apply(new ContactInfo("John Doe", null, null, null), 6))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("parties of 6 or more")
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.CONTACT_REQUIRED));
    }
}
