package personal.rezzy.reservation.hours.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Special Hours Not Found Exception
 */
public class SpecialHoursNotFoundException extends BusinessException {
    public SpecialHoursNotFoundException(UUID specialHoursId) {
        super(ErrorCode.SPECIAL_HOURS_NOT_FOUND,
                String.format("Special hours not found: specialHoursId=%s", specialHoursId));
    }

    public SpecialHoursNotFoundException(LocalDate date) {
        super(ErrorCode.SPECIAL_HOURS_NOT_FOUND,
                String.format("Special hours not found: date=%s", date));
    }
}
