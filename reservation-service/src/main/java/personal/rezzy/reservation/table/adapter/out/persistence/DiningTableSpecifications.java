package personal.rezzy.reservation.table.adapter.out.persistence;

import org.springframework.data.jpa.domain.Specification;
import personal.rezzy.reservation.table.domain.model.TableFilter;

/**
 * TableFilter 필드별 고정 조건
 * 값이 없는 필드는 조건에서 빠진다.
 */
final class DiningTableSpecifications {

    private DiningTableSpecifications() {
    }

    static Specification<DiningTableEntity> from(TableFilter filter) {
        return Specification.where(minCapacityAtLeast(filter.minCapacity()))
                .and(maxCapacityAtLeast(filter.maxCapacity()))
                .and(sharedEquals(filter.shared()))
                .and(locationEquals(filter.location()));
    }

    private static Specification<DiningTableEntity> minCapacityAtLeast(Integer value) {
        return value == null ? null
                : (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("minCapacity"), value);
    }

    private static Specification<DiningTableEntity> maxCapacityAtLeast(Integer value) {
        return value == null ? null
                : (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("maxCapacity"), value);
    }

    private static Specification<DiningTableEntity> sharedEquals(Boolean value) {
        return value == null ? null
                : (root, query, cb) -> cb.equal(root.get("shared"), value);
    }

    private static Specification<DiningTableEntity> locationEquals(String value) {
        return value == null ? null
                : (root, query, cb) -> cb.equal(root.get("location"), value);
    }
}
