package personal.rezzy.reservation.booking.application.port.in;

import personal.rezzy.reservation.booking.domain.model.ReservationDetails;

/**
 * Book Reservation UseCase (Input Port)
 * 테이블 락 → 영업시간 검증 → 가용성 재확인 → 고객 확인/등록 → 예약 및 배정 저장
 */
public interface BookReservationUseCase {
    ReservationDetails book(BookReservationCommand command);
}
