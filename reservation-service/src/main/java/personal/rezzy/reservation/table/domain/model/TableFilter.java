package personal.rezzy.reservation.table.domain.model;

/**
 * 테이블 목록 조회 조건
 * 각 필드는 null이면 무시되고, 값이 있으면 하나의 고정된 조건으로 변환된다.
 *
 * @param minCapacity min_capacity >= minCapacity
 * @param maxCapacity max_capacity >= maxCapacity
 * @param shared      is_shared = shared
 * @param location    location = location
 */
public record TableFilter(
        Integer minCapacity,
        Integer maxCapacity,
        Boolean shared,
        String location) {

    public static TableFilter none() {
        return new TableFilter(null, null, null, null);
    }
}
