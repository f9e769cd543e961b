package personal.rezzy.reservation.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reservation Status Enum
 * 외부 표현(API, DB)은 소문자 값을 사용한다.
 */
public enum ReservationStatus {
    /**
     * 예약 접수 (기본값)
     */
    PENDING("pending"),

    /**
     * 예약 확정
     */
    CONFIRMED("confirmed"),

    /**
     * 착석
     */
    SEATED("seated"),

    /**
     * 식사 완료
     */
    COMPLETED("completed"),

    /**
     * 취소
     */
    CANCELLED("cancelled"),

    /**
     * 노쇼
     */
    NO_SHOW("no_show");

    /**
     * 테이블 용량을 차지하는 상태 (가용성 계산 대상)
     */
    public static final Set<ReservationStatus> OCCUPYING =
            EnumSet.of(PENDING, CONFIRMED, SEATED, COMPLETED);

    /**
     * 아직 끝나지 않은 예약 상태 (테이블 삭제 차단 대상)
     */
    public static final Set<ReservationStatus> IN_PROGRESS =
            EnumSet.of(PENDING, CONFIRMED, SEATED);

    private final String value;

    ReservationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean occupiesTable() {
        return OCCUPYING.contains(this);
    }

    @JsonCreator
    public static ReservationStatus from(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("Invalid status '%s'. Must be one of: %s", value, validValues())));
    }

    private static String validValues() {
        return Arrays.stream(values())
                .map(ReservationStatus::value)
                .collect(Collectors.joining(", "));
    }
}
