package personal.rezzy.reservation.booking.application.port.in;

/**
 * Check Availability UseCase (Input Port)
 */
public interface CheckAvailabilityUseCase {
    AvailabilityResult checkAvailability(AvailabilityQuery query);
}
