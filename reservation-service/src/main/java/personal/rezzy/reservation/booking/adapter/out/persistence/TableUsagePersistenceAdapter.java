package personal.rezzy.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.table.application.port.out.TableUsageRepository;
import personal.rezzy.reservation.table.domain.model.TableUsage;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Table Usage Persistence Adapter
 * 테이블 수정/삭제 시 예약 배정 현황 확인과 정리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableUsagePersistenceAdapter implements TableUsageRepository {

    private final JpaTableAssignmentRepository jpaTableAssignmentRepository;

    @Override
    public boolean hasInProgressReservation(UUID tableId) {
        return jpaTableAssignmentRepository.existsByTableIdAndStatusIn(tableId, ReservationStatus.IN_PROGRESS);
    }

    @Override
    public List<TableUsage> findOccupyingFrom(UUID tableId, LocalDate fromDate) {
        return jpaTableAssignmentRepository.findOccupanciesFrom(tableId, fromDate, ReservationStatus.OCCUPYING)
                .stream()
                .map(TableOccupancyRow::toDomain)
                .map(occupancy -> new TableUsage(occupancy.reservationId(), occupancy.partySize(),
                        occupancy.window().start(), occupancy.window().end()))
                .toList();
    }

    @Override
    public void deleteAssignmentsByTableId(UUID tableId) {
        int deleted = jpaTableAssignmentRepository.deleteByTableId(tableId);
        log.debug("Deleted {} historical table assignments: tableId={}", deleted, tableId);
    }
}
