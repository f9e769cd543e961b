package personal.rezzy.reservation.table.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.table.application.port.out.TableRepository;
import personal.rezzy.reservation.table.domain.model.DiningTable;
import personal.rezzy.reservation.table.domain.model.TableFilter;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Table Persistence Adapter
 * JPA를 사용한 테이블 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TablePersistenceAdapter implements TableRepository {

    private static final Sort BY_TABLE_NUMBER = Sort.by(Sort.Direction.ASC, "tableNumber");

    private final JpaDiningTableRepository jpaDiningTableRepository;

    @Override
    public Optional<DiningTable> findById(UUID tableId) {
        log.debug("Finding table by id: {}", tableId);
        return jpaDiningTableRepository.findById(tableId)
                .map(DiningTableEntity::toDomain);
    }

    @Override
    public List<DiningTable> findAll(TableFilter filter) {
        return jpaDiningTableRepository.findAll(DiningTableSpecifications.from(filter), BY_TABLE_NUMBER)
                .stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public List<DiningTable> findAllById(Collection<UUID> tableIds) {
        if (tableIds.isEmpty()) {
            return List.of();
        }
        return jpaDiningTableRepository.findAllById(tableIds)
                .stream()
                .map(DiningTableEntity::toDomain)
                .sorted(Comparator.comparing(DiningTable::tableNumber))
                .toList();
    }

    @Override
    public List<DiningTable> findFitting(int partySize) {
        log.debug("Finding tables fitting party size: {}", partySize);
        return jpaDiningTableRepository.findFitting(partySize)
                .stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public List<DiningTable> findAllByIdForUpdate(Collection<UUID> tableIds) {
        if (tableIds.isEmpty()) {
            return List.of();
        }
        log.debug("Locking tables: {}", tableIds);
        return jpaDiningTableRepository.findAllByIdInForUpdate(tableIds)
                .stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public boolean existsByTableNumber(String tableNumber) {
        return jpaDiningTableRepository.existsByTableNumber(tableNumber);
    }

    @Override
    public boolean existsByTableNumberExcluding(String tableNumber, UUID excludedTableId) {
        return jpaDiningTableRepository.existsByTableNumberAndIdNot(tableNumber, excludedTableId);
    }

    @Override
    public DiningTable save(DiningTable table) {
        log.debug("Saving table: tableId={}, tableNumber={}", table.id(), table.tableNumber());
        // 유니크 제약 위반을 호출 지점에서 감지하기 위해 즉시 flush
        return jpaDiningTableRepository.saveAndFlush(DiningTableEntity.fromDomain(table))
                .toDomain();
    }

    @Override
    public void deleteById(UUID tableId) {
        jpaDiningTableRepository.deleteById(tableId);
    }
}
