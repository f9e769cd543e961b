package personal.rezzy.reservation.customer.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.application.config.BookingProperties;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 연락처 없는 소규모 일행용 대체 이메일 정책
 * <p>
 * 이메일과 전화번호가 모두 없고 일행이 기준 인원 미만이면
 * {@code guest-<md5(이름 소문자, 앞뒤 공백 제거) 앞 8자리>@<도메인>} 형식의 이메일을 만든다.
 * 같은 이름이면 같은 이메일이 나오므로 동명이인은 한 고객으로 합쳐진다.
 * 기준 인원 이상인 일행은 실제 연락처가 필요하다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaceholderContactPolicy {

    private static final int HASH_LENGTH = 8;

    private final BookingProperties bookingProperties;

    public ContactInfo apply(ContactInfo contact, int partySize) {
        if (contact.hasContact()) {
            return contact;
        }
        if (partySize >= bookingProperties.placeholderPartyLimit()) {
            log.warn("Contact required for large party: name={}, partySize={}", contact.name(), partySize);
            throw new BusinessException(ErrorCode.CONTACT_REQUIRED, String.format(
                    "Email or phone is required for parties of %d or more: partySize=%d",
                    bookingProperties.placeholderPartyLimit(), partySize));
        }
        return contact.withEmail(placeholderEmail(contact.name()));
    }

    public String placeholderEmail(String name) {
        String normalized = name.toLowerCase(Locale.ROOT).strip();
        String hash = DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8));
        return "guest-" + hash.substring(0, HASH_LENGTH) + "@" + bookingProperties.placeholderDomain();
    }
}
