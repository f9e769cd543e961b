package personal.rezzy.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import personal.rezzy.reservation.booking.application.config.BookingProperties;
import personal.rezzy.reservation.booking.application.port.in.BookReservationCommand;
import personal.rezzy.reservation.booking.application.port.out.ReservationRepository;
import personal.rezzy.reservation.booking.application.port.out.TableAssignmentRepository;
import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;
import personal.rezzy.reservation.customer.domain.model.Customer;
import personal.rezzy.reservation.customer.domain.service.CustomerRegistry;
import personal.rezzy.reservation.customer.domain.service.PlaceholderContactPolicy;
import personal.rezzy.reservation.hours.domain.service.OperatingHoursResolver;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Booking Domain Service (Transaction Manager)
 * 예약 생성의 검증과 저장을 하나의 트랜잭션으로 묶는다.
 * <p>
 * 순서:
 * 1. 요청 테이블 행 락 (ID 오름차순, 동시 예약 직렬화)
 * 2. 영업시간 검증 (캐시 없이 저장소에서 조회)
 * 3. 잠근 테이블의 가용성 재확인
 * 4. 연락처 보정 및 고객 확인/등록
 * 5. 예약, 테이블 배정 저장
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private final TableAvailabilityGuard tableAvailabilityGuard;
    private final OperatingHoursResolver operatingHoursResolver;
    private final PlaceholderContactPolicy placeholderContactPolicy;
    private final CustomerRegistry customerRegistry;
    private final ReservationRepository reservationRepository;
    private final TableAssignmentRepository tableAssignmentRepository;
    private final BookingProperties bookingProperties;

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public ReservationDetails book(BookReservationCommand command) {
        Set<UUID> tableIds = command.distinctTableIds();
        TimeWindow window = command.window(bookingProperties.defaultDurationMinutes());

        List<DiningTable> tables = tableAvailabilityGuard.lockTables(tableIds);
        operatingHoursResolver.requireAdmitted(window);
        tableAvailabilityGuard.requireAvailable(tables, command.partySize(), window, null, Set.of());

        ContactInfo contact = placeholderContactPolicy.apply(command.customer(), command.partySize());
        Customer customer = customerRegistry.findOrRegister(contact);

        Reservation saved = reservationRepository.save(Reservation.create(
                customer.id(), command.partySize(), window, command.notes(), command.status()));
        tableAssignmentRepository.saveAll(saved.id(), tableIds);

        List<DiningTable> sortedTables = tables.stream()
                .sorted(Comparator.comparing(DiningTable::tableNumber))
                .toList();
        return new ReservationDetails(saved, customer, sortedTables);
    }
}
