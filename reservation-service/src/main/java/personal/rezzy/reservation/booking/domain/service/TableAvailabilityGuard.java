package personal.rezzy.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.booking.application.port.out.TableOccupancyRepository;
import personal.rezzy.reservation.booking.domain.exception.TableNotAvailableException;
import personal.rezzy.reservation.booking.domain.model.AvailableTable;
import personal.rezzy.reservation.booking.domain.model.TableOccupancy;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.table.application.port.out.TableRepository;
import personal.rezzy.reservation.table.domain.exception.TableNotFoundException;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 예약 쓰기 경로에서 테이블 락과 가용성 재확인을 담당
 * 호출자의 트랜잭션 안에서만 사용한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableAvailabilityGuard {

    private final TableRepository tableRepository;
    private final TableOccupancyRepository tableOccupancyRepository;
    private final AvailabilityCalculator availabilityCalculator;

    /**
     * 테이블 행 락 (ID 오름차순)
     *
     * @throws TableNotFoundException 존재하지 않는 테이블이 섞여 있는 경우
     */
    public List<DiningTable> lockTables(Collection<UUID> tableIds) {
        List<DiningTable> locked = tableRepository.findAllByIdForUpdate(tableIds);
        if (locked.size() != tableIds.size()) {
            Set<UUID> found = locked.stream().map(DiningTable::id).collect(Collectors.toSet());
            UUID missing = tableIds.stream()
                    .filter(tableId -> !found.contains(tableId))
                    .findFirst()
                    .orElseThrow();
            throw new TableNotFoundException(missing);
        }
        return locked;
    }

    /**
     * 잠근 테이블이 모두 해당 시간에 일행을 받을 수 있는지 확인
     *
     * @throws TableNotAvailableException 하나라도 가용하지 않은 경우
     */
    public void requireAvailable(List<DiningTable> lockedTables, int partySize, TimeWindow window,
                                 UUID excludedReservationId, Set<UUID> heldTableIds) {
        Set<UUID> requested = lockedTables.stream().map(DiningTable::id).collect(Collectors.toSet());
        List<TableOccupancy> occupancies = tableOccupancyRepository.findOccupying(window.date(), requested);

        Set<UUID> available = availabilityCalculator.findAvailable(
                        lockedTables, occupancies, partySize, window, excludedReservationId, heldTableIds)
                .stream()
                .map(candidate -> candidate.table().id())
                .collect(Collectors.toSet());

        List<UUID> unavailable = requested.stream()
                .filter(tableId -> !available.contains(tableId))
                .sorted()
                .toList();
        if (!unavailable.isEmpty()) {
            log.warn("Tables not available: tableIds={}, partySize={}, date={}, start={}",
                    unavailable, partySize, window.date(), window.startTime());
            throw new TableNotAvailableException(unavailable, partySize, window);
        }
    }
}
