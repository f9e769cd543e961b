package personal.rezzy.reservation.hours.domain.model;

/**
 * 적용된 영업시간의 출처
 */
public enum HoursSource {
    /** 요일 정규 영업시간 */
    REGULAR,
    /** 날짜별 특별 영업시간 */
    SPECIAL,
    /** 해당 요일 영업시간 미등록 (휴무) */
    NONE
}
