package personal.rezzy.reservation.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.rezzy.reservation.booking.application.port.in.UpdateReservationCommand;
import personal.rezzy.reservation.booking.application.port.out.ReservationRepository;
import personal.rezzy.reservation.booking.application.port.out.TableAssignmentRepository;
import personal.rezzy.reservation.booking.application.port.out.TableOccupancyRepository;
import personal.rezzy.reservation.booking.domain.exception.ReservationNotFoundException;
import personal.rezzy.reservation.booking.domain.exception.TableNotAvailableException;
import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationChanges;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.booking.domain.model.TableOccupancy;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;
import personal.rezzy.reservation.customer.domain.model.Customer;
import personal.rezzy.reservation.hours.domain.service.OperatingHoursResolver;
import personal.rezzy.reservation.table.application.port.out.TableRepository;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * 실제 AvailabilityCalculator / TableAvailabilityGuard 위에서 수정 흐름을 검증한다.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationMutationManager 단위 테스트")
class ReservationMutationManagerTest {

    private static final LocalDate DATE = LocalDate.of(2030, 5, 10);

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private TableAssignmentRepository tableAssignmentRepository;

    @Mock
    private TableRepository tableRepository;

    @Mock
    private TableOccupancyRepository tableOccupancyRepository;

    @Mock
    private OperatingHoursResolver operatingHoursResolver;

    @Mock
    private ReservationDetailsAssembler reservationDetailsAssembler;

    private ReservationMutationManager manager;

    private final DiningTable t1 = DiningTable.create("T1", 2, 4, false, null);
    private final Customer customer = Customer.register(new ContactInfo("Jane", "jane@example.com", null, null));

    @BeforeEach
    void setUp() {
        TableAvailabilityGuard guard = new TableAvailabilityGuard(
                tableRepository, tableOccupancyRepository, new AvailabilityCalculator());
        manager = new ReservationMutationManager(reservationRepository, tableAssignmentRepository,
                guard, operatingHoursResolver, reservationDetailsAssembler);
    }

    private Reservation reservationOnT1(ReservationStatus status) {
        Reservation reservation = Reservation.create(customer.id(), 2,
                new TimeWindow(DATE, LocalTime.of(18, 0), 90), null, status);
        given(reservationRepository.findByIdForUpdate(reservation.id())).willReturn(Optional.of(reservation));
        // 상태 변경 경로에서는 배정 조회가 일어나지 않을 수 있다
        lenient().when(tableAssignmentRepository.findTableIdsByReservationId(reservation.id()))
                .thenReturn(List.of(t1.id()));
        return reservation;
    }

    private void stubSaveAndAssemble() {
        willAnswer(invocation -> invocation.getArgument(0)).given(reservationRepository).save(any());
        willAnswer(invocation -> new ReservationDetails(invocation.getArgument(0), customer, List.of(t1)))
                .given(reservationDetailsAssembler).assemble(any());
    }

    private static TableOccupancy occupancyOf(Reservation reservation, UUID tableId) {
        return new TableOccupancy(reservation.id(), tableId, reservation.partySize(),
                reservation.window(), reservation.status());
    }

    @Test
    @DisplayName("같은 테이블을 유지한 채 시작 시각만 바꾸면 자기 자신과 충돌하지 않는다")
    void reschedule_SameTableShiftedStart() {
        // given: 18:00-19:30 예약을 18:30으로 이동
        Reservation reservation = reservationOnT1(ReservationStatus.CONFIRMED);
        given(tableRepository.findAllByIdForUpdate(Set.of(t1.id()))).willReturn(List.of(t1));
        given(tableOccupancyRepository.findOccupying(eq(DATE), anyCollection()))
                .willReturn(List.of(occupancyOf(reservation, t1.id())));
        stubSaveAndAssemble();

        // when
        ReservationDetails details = manager.reschedule(new UpdateReservationCommand(reservation.id(),
                new ReservationChanges(null, null, LocalTime.of(18, 30), null, null, null), null));

        // then
        assertThat(details.reservation().startTime()).isEqualTo(LocalTime.of(18, 30));
        verify(operatingHoursResolver).requireAdmitted(new TimeWindow(DATE, LocalTime.of(18, 30), 90));
        verify(tableAssignmentRepository, never()).deleteByReservationId(any());
    }

    @Test
    @DisplayName("다른 예약과 겹치는 시각으로 옮기면 TableNotAvailableException")
    void reschedule_ConflictWithOther() {
        // given
        Reservation reservation = reservationOnT1(ReservationStatus.CONFIRMED);
        Reservation other = Reservation.create(UUID.randomUUID(), 2,
                new TimeWindow(DATE, LocalTime.of(20, 0), 90), null, ReservationStatus.PENDING);
        given(tableRepository.findAllByIdForUpdate(Set.of(t1.id()))).willReturn(List.of(t1));
        given(tableOccupancyRepository.findOccupying(eq(DATE), anyCollection()))
                .willReturn(List.of(occupancyOf(reservation, t1.id()), occupancyOf(other, t1.id())));

        // when & then
        assertThatThrownBy(() -> manager.reschedule(new UpdateReservationCommand(reservation.id(),
                new ReservationChanges(null, null, LocalTime.of(19, 30), null, null, null), null)))
                .isInstanceOf(TableNotAvailableException.class);
        verify(reservationRepository, never()).save(any());
    }

    @Test
    @DisplayName("배정된 테이블을 유지해도 최대 인원을 넘게 늘리면 TableNotAvailableException")
    void reschedule_PartyGrowsBeyondHeldTable() {
        // given: 2~4인 T1을 유지한 채 12명으로 변경
        Reservation reservation = reservationOnT1(ReservationStatus.CONFIRMED);
        given(tableRepository.findAllByIdForUpdate(Set.of(t1.id()))).willReturn(List.of(t1));
        given(tableOccupancyRepository.findOccupying(eq(DATE), anyCollection()))
                .willReturn(List.of(occupancyOf(reservation, t1.id())));

        // when & then
        assertThatThrownBy(() -> manager.reschedule(new UpdateReservationCommand(reservation.id(),
                new ReservationChanges(12, null, null, null, null, null), null)))
                .isInstanceOf(TableNotAvailableException.class);
        verify(reservationRepository, never()).save(any());
    }

    @Test
    @DisplayName("메모만 바꾸면 영업시간과 테이블 검증을 하지 않는다")
    void reschedule_NotesOnly() {
        Reservation reservation = reservationOnT1(ReservationStatus.CONFIRMED);
        stubSaveAndAssemble();

        ReservationDetails details = manager.reschedule(new UpdateReservationCommand(reservation.id(),
                new ReservationChanges(null, null, null, null, "birthday cake", null), null));

        assertThat(details.reservation().notes()).isEqualTo("birthday cake");
        verifyNoInteractions(operatingHoursResolver, tableRepository, tableOccupancyRepository);
    }

    @Test
    @DisplayName("테이블을 교체하면 기존 배정을 지우고 새로 저장한다")
    void reschedule_ReassignTables() {
        // given
        Reservation reservation = reservationOnT1(ReservationStatus.PENDING);
        DiningTable t2 = DiningTable.create("T2", 2, 4, false, null);
        given(tableRepository.findAllByIdForUpdate(Set.of(t2.id()))).willReturn(List.of(t2));
        given(tableOccupancyRepository.findOccupying(eq(DATE), anyCollection())).willReturn(List.of());
        stubSaveAndAssemble();

        // when
        manager.reschedule(new UpdateReservationCommand(reservation.id(), null, List.of(t2.id())));

        // then
        verify(tableAssignmentRepository).deleteByReservationId(reservation.id());
        verify(tableAssignmentRepository).saveAll(reservation.id(), Set.of(t2.id()));
        verifyNoInteractions(operatingHoursResolver);
    }

    @Test
    @DisplayName("취소된 예약을 다시 확정할 때 그 사이 테이블이 찼으면 거부한다")
    void changeStatus_ReactivateConflict() {
        // given
        Reservation cancelled = reservationOnT1(ReservationStatus.CANCELLED);
        Reservation newcomer = Reservation.create(UUID.randomUUID(), 2,
                new TimeWindow(DATE, LocalTime.of(18, 30), 90), null, ReservationStatus.CONFIRMED);
        given(tableRepository.findAllByIdForUpdate(Set.of(t1.id()))).willReturn(List.of(t1));
        given(tableOccupancyRepository.findOccupying(eq(DATE), anyCollection()))
                .willReturn(List.of(occupancyOf(newcomer, t1.id())));

        // when & then
        assertThatThrownBy(() -> manager.changeStatus(cancelled.id(), ReservationStatus.CONFIRMED))
                .isInstanceOf(TableNotAvailableException.class);
        verify(reservationRepository, never()).save(any());
    }

    @Test
    @DisplayName("활성 상태끼리의 변경은 용량을 다시 확인하지 않는다")
    void changeStatus_Seated() {
        Reservation reservation = reservationOnT1(ReservationStatus.CONFIRMED);
        stubSaveAndAssemble();

        ReservationDetails details = manager.changeStatus(reservation.id(), ReservationStatus.SEATED);

        assertThat(details.reservation().status()).isEqualTo(ReservationStatus.SEATED);
        verifyNoInteractions(tableRepository, tableOccupancyRepository);
    }

    @Test
    @DisplayName("없는 예약을 삭제하면 ReservationNotFoundException")
    void delete_NotFound() {
        UUID reservationId = UUID.randomUUID();
        given(reservationRepository.findByIdForUpdate(reservationId)).willReturn(Optional.empty());

        assertThatThrownBy(() -> manager.delete(reservationId))
                .isInstanceOf(ReservationNotFoundException.class)
                .hasMessageContaining(reservationId.toString());
        verify(tableAssignmentRepository, never()).deleteByReservationId(any());
    }
}
