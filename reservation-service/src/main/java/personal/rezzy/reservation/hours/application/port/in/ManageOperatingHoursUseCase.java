package personal.rezzy.reservation.hours.application.port.in;

import personal.rezzy.reservation.hours.domain.model.OperatingHours;
import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.util.UUID;

/**
 * Manage Operating Hours UseCase (Input Port)
 * 변경이 커밋되면 영업시간 캐시를 비운다.
 */
public interface ManageOperatingHoursUseCase {

    OperatingHours setWeeklyHours(SetOperatingHoursCommand command);

    SpecialHours setSpecialHours(SetSpecialHoursCommand command);

    /**
     * @throws personal.rezzy.reservation.hours.domain.exception.SpecialHoursNotFoundException 대상 없음
     */
    void deleteSpecialHours(UUID specialHoursId);
}
