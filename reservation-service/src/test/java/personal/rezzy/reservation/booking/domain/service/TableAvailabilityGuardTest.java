package personal.rezzy.reservation.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.rezzy.reservation.booking.application.port.out.TableOccupancyRepository;
import personal.rezzy.reservation.booking.domain.exception.TableNotAvailableException;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.booking.domain.model.TableOccupancy;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.table.application.port.out.TableRepository;
import personal.rezzy.reservation.table.domain.exception.TableNotFoundException;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("TableAvailabilityGuard 단위 테스트")
class TableAvailabilityGuardTest {

    private static final TimeWindow WINDOW = new TimeWindow(LocalDate.of(2030, 5, 10), LocalTime.of(18, 0), 90);

    @Mock
    private TableRepository tableRepository;

    @Mock
    private TableOccupancyRepository tableOccupancyRepository;

    private TableAvailabilityGuard guard() {
        return new TableAvailabilityGuard(tableRepository, tableOccupancyRepository, new AvailabilityCalculator());
    }

    @Test
    @DisplayName("요청한 테이블 중 없는 테이블이 있으면 TableNotFoundException")
    void lockTables_Missing() {
        // given
        DiningTable t1 = DiningTable.create("T1", 2, 4, false, null);
        UUID missing = UUID.randomUUID();
        Set<UUID> requested = new LinkedHashSet<>(List.of(t1.id(), missing));
        given(tableRepository.findAllByIdForUpdate(requested)).willReturn(List.of(t1));

        // when & then
        assertThatThrownBy(() -> guard().lockTables(requested))
                .isInstanceOf(TableNotFoundException.class)
                .hasMessageContaining(missing.toString());
    }

    @Test
    @DisplayName("하나라도 가용하지 않으면 해당 테이블 ID를 담아 TableNotAvailableException")
    void requireAvailable_Conflict() {
        // given
        DiningTable free = DiningTable.create("T1", 2, 4, false, null);
        DiningTable busy = DiningTable.create("T2", 2, 4, false, null);
        given(tableOccupancyRepository.findOccupying(eq(WINDOW.date()), anyCollection()))
                .willReturn(List.of(new TableOccupancy(UUID.randomUUID(), busy.id(), 2,
                        new TimeWindow(WINDOW.date(), LocalTime.of(17, 30), 60), ReservationStatus.CONFIRMED)));

        // when & then
        assertThatThrownBy(() -> guard().requireAvailable(List.of(free, busy), 2, WINDOW, null, Set.of()))
                .isInstanceOf(TableNotAvailableException.class)
                .hasMessageContaining(busy.id().toString())
                .satisfies(e -> assertThat(e.getMessage()).doesNotContain(free.id().toString()));
    }

    @Test
    @DisplayName("모든 테이블이 가용하면 통과한다")
    void requireAvailable_Pass() {
        DiningTable t1 = DiningTable.create("T1", 2, 4, false, null);
        given(tableOccupancyRepository.findOccupying(any(), anyCollection())).willReturn(List.of());

        assertThatCode(() -> guard().requireAvailable(List.of(t1), 3, WINDOW, null, Set.of()))
                .doesNotThrowAnyException();
    }
}
