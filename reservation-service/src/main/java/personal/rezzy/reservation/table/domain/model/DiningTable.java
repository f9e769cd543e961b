package personal.rezzy.reservation.table.domain.model;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Dining Table Domain Model
 * 물리적인 좌석 단위 (불변)
 * <p>
 * shared 테이블은 여러 일행이 최대 수용 인원 안에서 동시에 사용할 수 있다.
 */
public record DiningTable(
        UUID id,
        String tableNumber,
        int minCapacity,
        int maxCapacity,
        boolean shared,
        String location,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public static final int TABLE_NUMBER_MAX_LENGTH = 10;
    public static final int LOCATION_MAX_LENGTH = 50;

    public DiningTable {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
        }
        if (tableNumber == null || tableNumber.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table number cannot be blank");
        }
        if (tableNumber.length() > TABLE_NUMBER_MAX_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Table number must be at most " + TABLE_NUMBER_MAX_LENGTH + " characters");
        }
        if (minCapacity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "min_capacity must be positive");
        }
        if (maxCapacity < minCapacity) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "max_capacity must be greater than or equal to min_capacity");
        }
        if (location != null && location.length() > LOCATION_MAX_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Location must be at most " + LOCATION_MAX_LENGTH + " characters");
        }
    }

    /**
     * 테이블 생성 (정적 팩토리 메서드)
     */
    public static DiningTable create(String tableNumber, int minCapacity, int maxCapacity,
                                     boolean shared, String location) {
        LocalDateTime now = LocalDateTime.now();
        return new DiningTable(UUID.randomUUID(), tableNumber, minCapacity, maxCapacity,
                shared, location, now, now);
    }

    /**
     * 전체 속성 교체 (PUT 의미론)
     */
    public DiningTable update(String tableNumber, int minCapacity, int maxCapacity,
                              boolean shared, String location) {
        return new DiningTable(id, tableNumber, minCapacity, maxCapacity,
                shared, location, createdAt, LocalDateTime.now());
    }

    /**
     * 인원 범위 적합 여부 (min <= partySize <= max)
     */
    public boolean fits(int partySize) {
        return minCapacity <= partySize && partySize <= maxCapacity;
    }

    /**
     * 최소 인원과 일행 규모의 차이 (작을수록 공간 효율적)
     */
    public int fitDistance(int partySize) {
        return Math.abs(minCapacity - partySize);
    }
}
