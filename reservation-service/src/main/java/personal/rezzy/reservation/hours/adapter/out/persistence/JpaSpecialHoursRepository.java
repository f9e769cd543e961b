package personal.rezzy.reservation.hours.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Special Hours
 */
public interface JpaSpecialHoursRepository extends JpaRepository<SpecialHoursEntity, UUID> {

    Optional<SpecialHoursEntity> findBySpecialDate(LocalDate specialDate);

    @Query("SELECT s FROM SpecialHoursEntity s "
            + "WHERE (:dateFrom IS NULL OR s.specialDate >= :dateFrom) "
            + "AND (:dateTo IS NULL OR s.specialDate <= :dateTo) "
            + "ORDER BY s.specialDate")
    List<SpecialHoursEntity> findBetween(@Param("dateFrom") LocalDate dateFrom,
                                         @Param("dateTo") LocalDate dateTo);
}
