package personal.rezzy.reservation.booking.application.port.out;

import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationFilter;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reservation Repository (Output Port)
 */
public interface ReservationRepository {

    Optional<Reservation> findById(UUID reservationId);

    /**
     * 예약 행에 쓰기 락을 걸고 조회 (수정/상태 변경/삭제 경로)
     */
    Optional<Reservation> findByIdForUpdate(UUID reservationId);

    /**
     * 조건 조회 (예약 날짜, 시작 시각 오름차순)
     */
    List<Reservation> findAll(ReservationFilter filter);

    Reservation save(Reservation reservation);

    void deleteById(UUID reservationId);
}
