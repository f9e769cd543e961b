package personal.rezzy.reservation.hours.application.port.out;

import personal.rezzy.reservation.hours.domain.model.OperatingHours;

import java.util.List;
import java.util.Optional;

/**
 * Operating Hours Repository (Output Port)
 */
public interface OperatingHoursRepository {

    /**
     * 요일 순서(0=월요일)로 정렬된 주간 영업시간
     */
    List<OperatingHours> findAll();

    Optional<OperatingHours> findByDayOfWeek(int dayOfWeek);

    OperatingHours save(OperatingHours hours);
}
