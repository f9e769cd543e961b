package personal.rezzy.reservation.table.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Dining Table
 */
public interface JpaDiningTableRepository
        extends JpaRepository<DiningTableEntity, UUID>, JpaSpecificationExecutor<DiningTableEntity> {

    @Query("SELECT t FROM DiningTableEntity t "
            + "WHERE t.minCapacity <= :partySize AND t.maxCapacity >= :partySize "
            + "ORDER BY t.tableNumber")
    List<DiningTableEntity> findFitting(@Param("partySize") int partySize);

    /**
     * 비관적 쓰기 락 (SELECT ... FOR UPDATE), 최대 3초 대기
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT t FROM DiningTableEntity t WHERE t.id IN :ids ORDER BY t.id")
    List<DiningTableEntity> findAllByIdInForUpdate(@Param("ids") Collection<UUID> ids);

    boolean existsByTableNumber(String tableNumber);

    boolean existsByTableNumberAndIdNot(String tableNumber, UUID id);
}
