package personal.rezzy.reservation.booking.application.port.in;

import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;

import java.util.UUID;

/**
 * Manage Reservation UseCase (Input Port)
 */
public interface ManageReservationUseCase {

    /**
     * 부분 수정. 시간, 인원, 테이블이 바뀌면 영업시간과 가용성을 다시 검증한다.
     */
    ReservationDetails updateReservation(UpdateReservationCommand command);

    /**
     * 상태만 변경. cancelled/no_show에서 다시 활성 상태로 바뀌면 테이블 용량을 재확인한다.
     */
    ReservationDetails changeStatus(UUID reservationId, ReservationStatus status);

    void deleteReservation(UUID reservationId);
}
