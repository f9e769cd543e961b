package personal.rezzy.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.rezzy.reservation.booking.application.port.in.GetReservationUseCase;
import personal.rezzy.reservation.booking.application.port.out.ReservationRepository;
import personal.rezzy.reservation.booking.domain.exception.ReservationNotFoundException;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationFilter;
import personal.rezzy.reservation.booking.domain.service.ReservationDetailsAssembler;

import java.util.List;
import java.util.UUID;

/**
 * Reservation Query Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationQueryService implements GetReservationUseCase {

    private final ReservationRepository reservationRepository;
    private final ReservationDetailsAssembler reservationDetailsAssembler;

    @Override
    public ReservationDetails getReservation(UUID reservationId) {
        log.debug("Getting reservation: reservationId={}", reservationId);
        return reservationRepository.findById(reservationId)
                .map(reservationDetailsAssembler::assemble)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }

    @Override
    public List<ReservationDetails> getReservations(ReservationFilter filter) {
        log.debug("Getting reservations: filter={}", filter);
        return reservationDetailsAssembler.assembleAll(reservationRepository.findAll(filter));
    }
}
