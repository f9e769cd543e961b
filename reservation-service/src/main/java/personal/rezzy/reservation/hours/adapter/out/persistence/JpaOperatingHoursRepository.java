package personal.rezzy.reservation.hours.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Operating Hours
 */
public interface JpaOperatingHoursRepository extends JpaRepository<OperatingHoursEntity, UUID> {

    Optional<OperatingHoursEntity> findByDayOfWeek(int dayOfWeek);

    List<OperatingHoursEntity> findAllByOrderByDayOfWeekAsc();
}
