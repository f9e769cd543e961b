package personal.rezzy.reservation.table.application.port.out;

import personal.rezzy.reservation.table.domain.model.DiningTable;
import personal.rezzy.reservation.table.domain.model.TableFilter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Table Repository (Output Port)
 * 테이블 저장소 인터페이스
 */
public interface TableRepository {

    Optional<DiningTable> findById(UUID tableId);

    /**
     * 조건에 맞는 테이블 목록 (테이블 번호 오름차순)
     */
    List<DiningTable> findAll(TableFilter filter);

    /**
     * ID 목록으로 조회 (테이블 번호 오름차순, 없는 ID는 무시)
     */
    List<DiningTable> findAllById(Collection<UUID> tableIds);

    /**
     * 일행 규모가 min_capacity ~ max_capacity 범위에 들어가는 테이블 목록
     */
    List<DiningTable> findFitting(int partySize);

    /**
     * 테이블 행에 쓰기 락(SELECT ... FOR UPDATE)을 걸고 조회
     * 데드락 방지를 위해 항상 ID 오름차순으로 잠근다.
     *
     * @param tableIds 잠글 테이블 ID
     * @return 존재하는 테이블만 반환 (ID 오름차순)
     */
    List<DiningTable> findAllByIdForUpdate(Collection<UUID> tableIds);

    boolean existsByTableNumber(String tableNumber);

    boolean existsByTableNumberExcluding(String tableNumber, UUID excludedTableId);

    DiningTable save(DiningTable table);

    void deleteById(UUID tableId);
}
