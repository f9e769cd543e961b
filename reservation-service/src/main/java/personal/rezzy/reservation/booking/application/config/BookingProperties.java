package personal.rezzy.reservation.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Booking 설정 Properties
 * application.yml의 booking.* 설정을 바인딩
 *
 * @param defaultDurationMinutes 소요 시간 미지정 시 기본값 (분)
 * @param placeholderPartyLimit  이 인원 미만이고 연락처가 없으면 대체 이메일 생성
 * @param placeholderDomain      대체 이메일 도메인
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
        @DefaultValue("90") int defaultDurationMinutes,
        @DefaultValue("6") int placeholderPartyLimit,
        @DefaultValue("restaurant.local") String placeholderDomain
) {
}
