package personal.rezzy.reservation.booking.domain.exception;

import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Reservation Not Found Exception
 */
public class ReservationNotFoundException extends BusinessException {
    public ReservationNotFoundException(UUID reservationId) {
        super(ErrorCode.RESERVATION_NOT_FOUND,
                String.format("Reservation not found: reservationId=%s", reservationId));
    }
}
