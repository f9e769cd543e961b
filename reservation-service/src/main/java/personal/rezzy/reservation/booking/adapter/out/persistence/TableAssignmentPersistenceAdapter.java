package personal.rezzy.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.booking.application.port.out.TableAssignmentRepository;
import personal.rezzy.reservation.booking.application.port.out.TableOccupancyRepository;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.booking.domain.model.TableOccupancy;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Table Assignment Persistence Adapter
 * 배정 저장/삭제와 날짜별 점유 조회
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableAssignmentPersistenceAdapter implements TableAssignmentRepository, TableOccupancyRepository {

    private final JpaTableAssignmentRepository jpaTableAssignmentRepository;

    @Override
    public List<UUID> findTableIdsByReservationId(UUID reservationId) {
        return jpaTableAssignmentRepository.findByReservationId(reservationId).stream()
                .map(TableAssignmentEntity::getTableId)
                .toList();
    }

    @Override
    public Map<UUID, List<UUID>> findTableIdsByReservationIds(Collection<UUID> reservationIds) {
        if (reservationIds.isEmpty()) {
            return Map.of();
        }
        return jpaTableAssignmentRepository.findByReservationIdIn(reservationIds).stream()
                .collect(Collectors.groupingBy(
                        TableAssignmentEntity::getReservationId,
                        Collectors.mapping(TableAssignmentEntity::getTableId, Collectors.toList())));
    }

    @Override
    public void saveAll(UUID reservationId, Collection<UUID> tableIds) {
        log.debug("Assigning tables: reservationId={}, tableIds={}", reservationId, tableIds);
        List<TableAssignmentEntity> entities = tableIds.stream()
                .map(tableId -> TableAssignmentEntity.of(reservationId, tableId))
                .toList();
        // (reservation_id, table_id) 유니크 제약 위반을 호출 지점에서 감지하기 위해 즉시 flush
        jpaTableAssignmentRepository.saveAllAndFlush(entities);
    }

    @Override
    public void deleteByReservationId(UUID reservationId) {
        int deleted = jpaTableAssignmentRepository.deleteByReservationId(reservationId);
        log.debug("Deleted {} table assignments: reservationId={}", deleted, reservationId);
    }

    @Override
    public List<TableOccupancy> findOccupying(LocalDate date) {
        return jpaTableAssignmentRepository.findOccupancies(date, ReservationStatus.OCCUPYING).stream()
                .map(TableOccupancyRow::toDomain)
                .toList();
    }

    @Override
    public List<TableOccupancy> findOccupying(LocalDate date, Collection<UUID> tableIds) {
        if (tableIds.isEmpty()) {
            return List.of();
        }
        return jpaTableAssignmentRepository.findOccupancies(date, ReservationStatus.OCCUPYING, tableIds).stream()
                .map(TableOccupancyRow::toDomain)
                .toList();
    }
}
