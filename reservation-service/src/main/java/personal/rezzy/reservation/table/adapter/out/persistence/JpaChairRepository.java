package personal.rezzy.reservation.table.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Chair
 */
public interface JpaChairRepository extends JpaRepository<ChairEntity, UUID> {

    List<ChairEntity> findByTableIdOrderByPositionAsc(UUID tableId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ChairEntity c WHERE c.tableId = :tableId")
    int deleteByTableId(@Param("tableId") UUID tableId);
}
