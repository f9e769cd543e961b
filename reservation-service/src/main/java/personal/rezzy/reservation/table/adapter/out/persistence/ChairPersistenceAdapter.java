package personal.rezzy.reservation.table.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.table.application.port.out.ChairRepository;
import personal.rezzy.reservation.table.domain.model.Chair;

import java.util.List;
import java.util.UUID;

/**
 * Chair Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChairPersistenceAdapter implements ChairRepository {

    private final JpaChairRepository jpaChairRepository;

    @Override
    public List<Chair> findByTableId(UUID tableId) {
        return jpaChairRepository.findByTableIdOrderByPositionAsc(tableId)
                .stream()
                .map(ChairEntity::toDomain)
                .toList();
    }

    @Override
    public void saveAll(List<Chair> chairs) {
        log.debug("Saving {} chairs", chairs.size());
        jpaChairRepository.saveAll(chairs.stream().map(ChairEntity::fromDomain).toList());
    }

    @Override
    public void deleteAll(List<Chair> chairs) {
        log.debug("Deleting {} chairs", chairs.size());
        jpaChairRepository.deleteAllByIdInBatch(chairs.stream().map(Chair::id).toList());
    }

    @Override
    public void deleteByTableId(UUID tableId) {
        int deleted = jpaChairRepository.deleteByTableId(tableId);
        log.debug("Deleted chairs of table: tableId={}, count={}", tableId, deleted);
    }
}
