package personal.rezzy.reservation.booking.application.port.in;

import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationFilter;

import java.util.List;
import java.util.UUID;

/**
 * Get Reservation UseCase (Input Port)
 */
public interface GetReservationUseCase {

    ReservationDetails getReservation(UUID reservationId);

    List<ReservationDetails> getReservations(ReservationFilter filter);
}
