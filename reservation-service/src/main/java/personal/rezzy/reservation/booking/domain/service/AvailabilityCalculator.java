package personal.rezzy.reservation.booking.domain.service;

import org.springframework.stereotype.Component;
import personal.rezzy.reservation.booking.domain.model.AvailableTable;
import personal.rezzy.reservation.booking.domain.model.TableOccupancy;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Availability Calculator (Domain Service)
 * 테이블 목록과 점유 정보로 일행이 앉을 수 있는 테이블을 계산한다. 저장소에 접근하지 않는다.
 * <p>
 * 규칙:
 * <ul>
 *   <li>min_capacity &lt;= partySize &lt;= max_capacity 인 테이블만 후보</li>
 *   <li>비공유 테이블: 겹치는 점유 예약이 하나라도 있으면 제외</li>
 *   <li>공유 테이블: max_capacity - (겹치는 예약 인원 합) &gt;= partySize 이면 후보</li>
 *   <li>정렬: |min_capacity - partySize| 오름차순, 테이블 번호 오름차순</li>
 * </ul>
 * cancelled, no_show 예약은 용량을 차지하지 않는다.
 */
@Component
public class AvailabilityCalculator {

    public List<AvailableTable> findAvailable(List<DiningTable> tables,
                                              List<TableOccupancy> occupancies,
                                              int partySize,
                                              TimeWindow window) {
        return findAvailable(tables, occupancies, partySize, window, null, Set.of());
    }

    /**
     * 기존 예약을 수정할 때의 가용성 계산
     *
     * @param excludedReservationId 점유 계산에서 제외할 예약 (수정 대상 자신)
     * @param heldTableIds          수정 대상이 이미 배정받은 테이블. 최소 인원 검사만 건너뛰고
     *                              최대 인원과 다른 예약과의 충돌 검사는 그대로 받는다.
     */
    public List<AvailableTable> findAvailable(List<DiningTable> tables,
                                              List<TableOccupancy> occupancies,
                                              int partySize,
                                              TimeWindow window,
                                              UUID excludedReservationId,
                                              Set<UUID> heldTableIds) {
        List<AvailableTable> available = new ArrayList<>();
        for (DiningTable table : tables) {
            boolean held = heldTableIds.contains(table.id());
            if (held ? partySize > table.maxCapacity() : !table.fits(partySize)) {
                continue;
            }
            List<TableOccupancy> overlapping = occupancies.stream()
                    .filter(occupancy -> occupancy.tableId().equals(table.id()))
                    .filter(occupancy -> !Objects.equals(occupancy.reservationId(), excludedReservationId))
                    .filter(occupancy -> occupancy.status().occupiesTable())
                    .filter(occupancy -> occupancy.window().overlaps(window))
                    .toList();

            if (!table.shared()) {
                if (overlapping.isEmpty()) {
                    available.add(new AvailableTable(table, table.maxCapacity()));
                }
                continue;
            }

            int occupied = overlapping.stream().mapToInt(TableOccupancy::partySize).sum();
            int remaining = table.maxCapacity() - occupied;
            if (remaining >= partySize) {
                available.add(new AvailableTable(table, remaining));
            }
        }

        available.sort(Comparator
                .comparingInt((AvailableTable candidate) -> candidate.table().fitDistance(partySize))
                .thenComparing(candidate -> candidate.table().tableNumber()));
        return available;
    }
}
