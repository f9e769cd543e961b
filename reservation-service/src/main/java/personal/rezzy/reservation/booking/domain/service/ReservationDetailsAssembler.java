package personal.rezzy.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.booking.application.port.out.TableAssignmentRepository;
import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.customer.application.port.out.CustomerRepository;
import personal.rezzy.reservation.customer.domain.model.Customer;
import personal.rezzy.reservation.table.application.port.out.TableRepository;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 예약에 고객과 배정 테이블을 붙여 ReservationDetails로 만든다.
 * 목록은 고객/배정/테이블을 각각 한 번씩 조회한다.
 */
@Component
@RequiredArgsConstructor
public class ReservationDetailsAssembler {

    private final CustomerRepository customerRepository;
    private final TableAssignmentRepository tableAssignmentRepository;
    private final TableRepository tableRepository;

    public ReservationDetails assemble(Reservation reservation) {
        return assembleAll(List.of(reservation)).get(0);
    }

    public List<ReservationDetails> assembleAll(List<Reservation> reservations) {
        if (reservations.isEmpty()) {
            return List.of();
        }
        Set<UUID> reservationIds = reservations.stream().map(Reservation::id).collect(Collectors.toSet());
        Set<UUID> customerIds = reservations.stream().map(Reservation::customerId).collect(Collectors.toSet());

        Map<UUID, Customer> customers = customerRepository.findAllById(customerIds).stream()
                .collect(Collectors.toMap(Customer::id, Function.identity()));
        Map<UUID, List<UUID>> assignments = tableAssignmentRepository.findTableIdsByReservationIds(reservationIds);
        Set<UUID> tableIds = assignments.values().stream()
                .flatMap(Collection::stream)
                .collect(Collectors.toSet());
        // 테이블 번호 순서를 유지한다
        List<DiningTable> tables = tableRepository.findAllById(tableIds);

        return reservations.stream()
                .map(reservation -> {
                    Customer customer = customers.get(reservation.customerId());
                    if (customer == null) {
                        throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                                "Customer missing for reservation: reservationId=" + reservation.id());
                    }
                    Set<UUID> assigned = Set.copyOf(assignments.getOrDefault(reservation.id(), List.of()));
                    List<DiningTable> reservationTables = tables.stream()
                            .filter(table -> assigned.contains(table.id()))
                            .toList();
                    return new ReservationDetails(reservation, customer, reservationTables);
                })
                .toList();
    }
}
