package personal.rezzy.reservation.hours.application.port.out;

import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Special Hours Repository (Output Port)
 */
public interface SpecialHoursRepository {

    Optional<SpecialHours> findById(UUID specialHoursId);

    Optional<SpecialHours> findByDate(LocalDate date);

    /**
     * 기간 내 특별 영업시간 (날짜 오름차순, null 경계는 무시)
     */
    List<SpecialHours> findBetween(LocalDate dateFrom, LocalDate dateTo);

    SpecialHours save(SpecialHours specialHours);

    void deleteById(UUID specialHoursId);
}
