package personal.rezzy.reservation.hours.application.port.in;

import personal.rezzy.reservation.hours.domain.model.EffectiveHours;
import personal.rezzy.reservation.hours.domain.model.OperatingHours;
import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Operating Hours UseCase (Input Port)
 */
public interface GetOperatingHoursUseCase {

    List<OperatingHours> getWeeklyHours();

    List<SpecialHours> getSpecialHours(LocalDate dateFrom, LocalDate dateTo);

    SpecialHours getSpecialHours(LocalDate date);

    /**
     * 날짜에 적용되는 영업시간 (캐시 사용)
     */
    EffectiveHours getEffectiveHours(LocalDate date);
}
