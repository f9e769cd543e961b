package personal.rezzy.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.rezzy.reservation.booking.application.port.in.BookReservationCommand;
import personal.rezzy.reservation.booking.application.port.in.BookReservationUseCase;
import personal.rezzy.reservation.booking.application.port.in.ManageReservationUseCase;
import personal.rezzy.reservation.booking.application.port.in.UpdateReservationCommand;
import personal.rezzy.reservation.booking.domain.exception.ConcurrentReservationException;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.booking.domain.service.BookingManager;
import personal.rezzy.reservation.booking.domain.service.ReservationMutationManager;

import java.util.UUID;

/**
 * Reservation Application Service
 * 트랜잭션은 BookingManager / ReservationMutationManager가 연다.
 * 이 클래스는 트랜잭션 밖에서 롤백된 유니크 제약 위반을 받아
 * 예약 생성은 한 번 재시도하고, 그래도 실패하면 충돌 오류로 바꾼다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService implements BookReservationUseCase, ManageReservationUseCase {

    private final BookingManager bookingManager;
    private final ReservationMutationManager reservationMutationManager;

    @Override
    public ReservationDetails book(BookReservationCommand command) {
        log.info("Booking reservation: partySize={}, date={}, start={}, tableIds={}",
                command.partySize(), command.reservationDate(), command.startTime(), command.tableIds());
        ReservationDetails booked;
        try {
            booked = bookingManager.book(command);
        } catch (DataIntegrityViolationException first) {
            // 같은 연락처의 첫 예약이 동시에 들어오면 고객 유니크 인덱스에서 한쪽이 진다.
            // 트랜잭션은 이미 롤백됐으므로 한 번 더 시도하면 먼저 등록된 고객을 찾고 테이블도 다시 검증한다.
            log.warn("Unique violation while booking, retrying once: tableIds={}, cause={}",
                    command.tableIds(), first.getMostSpecificCause().getMessage());
            booked = retryBook(command);
        }
        log.info("Reservation booked: reservationId={}, customerId={}, tables={}",
                booked.reservation().id(), booked.customer().id(), booked.tables().size());
        return booked;
    }

    private ReservationDetails retryBook(BookReservationCommand command) {
        try {
            return bookingManager.book(command);
        } catch (DataIntegrityViolationException e) {
            // 2차 방어: 재시도에서도 DB 유니크 제약 위반이면 동시 예약 충돌로 본다
            log.error("Concurrent reservation detected: tableIds={}", command.tableIds(), e);
            throw new ConcurrentReservationException(command.tableIds(), e);
        }
    }

    @Override
    public ReservationDetails updateReservation(UpdateReservationCommand command) {
        log.info("Updating reservation: reservationId={}, changes={}, tableIds={}",
                command.reservationId(), command.changes(), command.tableIds());
        try {
            return reservationMutationManager.reschedule(command);
        } catch (DataIntegrityViolationException e) {
            log.error("Concurrent reservation update detected: reservationId={}", command.reservationId(), e);
            throw new ConcurrentReservationException(command.distinctTableIds(), e);
        }
    }

    @Override
    public ReservationDetails changeStatus(UUID reservationId, ReservationStatus status) {
        return reservationMutationManager.changeStatus(reservationId, status);
    }

    @Override
    public void deleteReservation(UUID reservationId) {
        reservationMutationManager.delete(reservationId);
    }
}
