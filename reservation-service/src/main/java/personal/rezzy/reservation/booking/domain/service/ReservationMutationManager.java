package personal.rezzy.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import personal.rezzy.reservation.booking.application.port.in.UpdateReservationCommand;
import personal.rezzy.reservation.booking.application.port.out.ReservationRepository;
import personal.rezzy.reservation.booking.application.port.out.TableAssignmentRepository;
import personal.rezzy.reservation.booking.domain.exception.ReservationNotFoundException;
import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationChanges;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.hours.domain.service.OperatingHoursResolver;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Reservation Mutation Domain Service (Transaction Manager)
 * 예약 수정, 상태 변경, 삭제
 * <p>
 * 락 순서: 예약 행 → 테이블 행 (ID 오름차순)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationMutationManager {

    private final ReservationRepository reservationRepository;
    private final TableAssignmentRepository tableAssignmentRepository;
    private final TableAvailabilityGuard tableAvailabilityGuard;
    private final OperatingHoursResolver operatingHoursResolver;
    private final ReservationDetailsAssembler reservationDetailsAssembler;

    /**
     * 부분 수정
     * <ul>
     *   <li>날짜/시작 시각/소요 시간이 바뀌면 변경 후 구간으로 영업시간 검증</li>
     *   <li>구간, 인원, 테이블 중 하나라도 바뀌면 자기 자신의 점유를 뺀 가용성으로 테이블 검증.
     *       현재 배정된 테이블은 인원 범위 검사를 건너뛴다.</li>
     *   <li>테이블 교체는 기존 배정 전체 삭제 후 새로 저장</li>
     * </ul>
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public ReservationDetails reschedule(UpdateReservationCommand command) {
        Reservation current = lockReservation(command.reservationId());
        ReservationChanges changes = command.changes();
        Reservation updated = current.apply(changes);

        Set<UUID> heldTableIds = new LinkedHashSet<>(
                tableAssignmentRepository.findTableIdsByReservationId(current.id()));
        Set<UUID> effectiveTableIds = command.reassignsTables() ? command.distinctTableIds() : heldTableIds;

        if (changes.changesWindow()) {
            operatingHoursResolver.requireAdmitted(updated.window());
        }

        boolean capacityAffected = changes.changesWindow()
                || updated.partySize() != current.partySize()
                || command.reassignsTables()
                || current.reoccupiesWith(updated.status());
        if (capacityAffected && updated.occupiesTables()) {
            List<DiningTable> tables = tableAvailabilityGuard.lockTables(effectiveTableIds);
            tableAvailabilityGuard.requireAvailable(
                    tables, updated.partySize(), updated.window(), current.id(), heldTableIds);
        } else if (command.reassignsTables()) {
            // 용량 검증 대상이 아니어도 존재하지 않는 테이블은 배정할 수 없다
            tableAvailabilityGuard.lockTables(effectiveTableIds);
        }

        Reservation saved = reservationRepository.save(updated);
        if (command.reassignsTables()) {
            tableAssignmentRepository.deleteByReservationId(saved.id());
            tableAssignmentRepository.saveAll(saved.id(), effectiveTableIds);
        }

        log.info("Reservation updated: reservationId={}, date={}, start={}, duration={}, partySize={}, status={}, tablesReassigned={}",
                saved.id(), saved.reservationDate(), saved.startTime(), saved.durationMinutes(),
                saved.partySize(), saved.status().value(), command.reassignsTables());
        return reservationDetailsAssembler.assemble(saved);
    }

    /**
     * 상태 변경. 시간 재검증은 하지 않는다.
     * 비활성 상태에서 활성 상태로 돌아오면 배정 테이블의 용량을 다시 확인한다.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public ReservationDetails changeStatus(UUID reservationId, ReservationStatus status) {
        Reservation current = lockReservation(reservationId);

        if (current.reoccupiesWith(status)) {
            Set<UUID> heldTableIds = new LinkedHashSet<>(
                    tableAssignmentRepository.findTableIdsByReservationId(reservationId));
            List<DiningTable> tables = tableAvailabilityGuard.lockTables(heldTableIds);
            tableAvailabilityGuard.requireAvailable(
                    tables, current.partySize(), current.window(), reservationId, heldTableIds);
        }

        Reservation saved = reservationRepository.save(current.changeStatus(status));
        log.info("Reservation status changed: reservationId={}, {} -> {}",
                reservationId, current.status().value(), saved.status().value());
        return reservationDetailsAssembler.assemble(saved);
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void delete(UUID reservationId) {
        lockReservation(reservationId);

        tableAssignmentRepository.deleteByReservationId(reservationId);
        reservationRepository.deleteById(reservationId);
        log.info("Reservation deleted: reservationId={}", reservationId);
    }

    private Reservation lockReservation(UUID reservationId) {
        return reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }
}
