package personal.rezzy.reservation.booking.application.port.in;

import personal.rezzy.reservation.booking.domain.model.AvailableTable;

import java.util.List;

/**
 * 가용 테이블 조회 결과
 * 영업시간 밖이면 validTime=false, 테이블 목록은 비어 있다.
 */
public record AvailabilityResult(
        boolean validTime,
        List<AvailableTable> availableTables
) {
    public static AvailabilityResult invalidTime() {
        return new AvailabilityResult(false, List.of());
    }

    public static AvailabilityResult of(List<AvailableTable> availableTables) {
        return new AvailabilityResult(true, List.copyOf(availableTables));
    }
}
