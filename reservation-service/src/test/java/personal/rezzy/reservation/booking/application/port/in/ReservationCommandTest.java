package personal.rezzy.reservation.booking.application.port.in;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("예약 커맨드 검증 테스트")
class ReservationCommandTest {

    private static final ContactInfo JANE = new ContactInfo("Jane", "jane@example.com", null, null);
    private static final LocalDate DATE = LocalDate.of(2030, 5, 10);
    private static final LocalTime START = LocalTime.of(18, 0);

    @Test
    @DisplayName("불변 리스트로 테이블을 넘겨도 예약 커맨드를 만들 수 있다")
    void book_ImmutableTableList() {
        // given
        UUID t1 = UUID.randomUUID();

        // when
        BookReservationCommand command =
                new BookReservationCommand(JANE, 2, DATE, START, 90, null, null, List.of(t1, t1));

        // then
        assertThat(command.tableIds()).containsExactly(t1, t1);
        assertThat(command.distinctTableIds()).containsExactly(t1);
    }

    @Test
    @DisplayName("테이블 목록에 null이 섞이면 INVALID_INPUT")
    void book_NullTableId() {
        List<UUID> tableIds = Arrays.asList(UUID.randomUUID(), null);

        assertThatThrownBy(() -> new BookReservationCommand(JANE, 2, DATE, START, 90, null, null, tableIds))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    @DisplayName("불변 리스트로 테이블을 교체하는 수정 커맨드를 만들 수 있다")
    void update_ImmutableTableList() {
        UUID t2 = UUID.randomUUID();

        UpdateReservationCommand command = new UpdateReservationCommand(UUID.randomUUID(), null, List.of(t2));

        assertThat(command.reassignsTables()).isTrue();
        assertThat(command.distinctTableIds()).containsExactly(t2);
    }

    @Test
    @DisplayName("수정 커맨드의 테이블 목록에 null이 섞이면 INVALID_INPUT")
    void update_NullTableId() {
        List<UUID> tableIds = Arrays.asList(null, UUID.randomUUID());

        assertThatThrownBy(() -> new UpdateReservationCommand(UUID.randomUUID(), null, tableIds))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }
}
