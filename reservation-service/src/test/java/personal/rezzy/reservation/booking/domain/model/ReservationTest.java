package personal.rezzy.reservation.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.rezzy.common.exception.BusinessException;
import personal.rezzy.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Reservation 도메인 단위 테스트")
class ReservationTest {

    private static final TimeWindow WINDOW = new TimeWindow(LocalDate.of(2030, 5, 10), LocalTime.of(18, 0), 90);

    @Test
    @DisplayName("상태를 지정하지 않으면 pending으로 생성된다")
    void create_DefaultsToPending() {
        Reservation reservation = Reservation.create(UUID.randomUUID(), 2, WINDOW, null, null);

        assertThat(reservation.status()).isEqualTo(ReservationStatus.PENDING);
        assertThat(reservation.occupiesTables()).isTrue();
    }

    @Test
    @DisplayName("부분 수정은 지정한 필드만 바꾼다")
    void apply_OnlyChangesGivenFields() {
        // given
        Reservation reservation = Reservation.create(UUID.randomUUID(), 2, WINDOW, "window seat", null);
        ReservationChanges changes = new ReservationChanges(4, null, LocalTime.of(19, 0), null, null, null);

        // when
        Reservation updated = reservation.apply(changes);

        // then
        assertThat(updated.id()).isEqualTo(reservation.id());
        assertThat(updated.partySize()).isEqualTo(4);
        assertThat(updated.startTime()).isEqualTo(LocalTime.of(19, 0));
        assertThat(updated.reservationDate()).isEqualTo(reservation.reservationDate());
        assertThat(updated.durationMinutes()).isEqualTo(90);
        assertThat(updated.notes()).isEqualTo("window seat");
        assertThat(updated.status()).isEqualTo(ReservationStatus.PENDING);
    }

    @Test
    @DisplayName("취소된 예약이 활성 상태로 돌아가면 테이블을 다시 차지한다")
    void reoccupiesWith() {
        Reservation cancelled = Reservation.create(UUID.randomUUID(), 2, WINDOW, null, ReservationStatus.CANCELLED);
        Reservation confirmed = Reservation.create(UUID.randomUUID(), 2, WINDOW, null, ReservationStatus.CONFIRMED);

        assertThat(cancelled.reoccupiesWith(ReservationStatus.CONFIRMED)).isTrue();
        assertThat(cancelled.reoccupiesWith(ReservationStatus.NO_SHOW)).isFalse();
        assertThat(confirmed.reoccupiesWith(ReservationStatus.SEATED)).isFalse();
    }

    @Test
    @DisplayName("완료된 예약은 용량을 차지하지만 진행 중 상태는 아니다")
    void statusSets() {
        assertThat(ReservationStatus.COMPLETED.occupiesTable()).isTrue();
        assertThat(ReservationStatus.IN_PROGRESS).doesNotContain(ReservationStatus.COMPLETED);
        assertThat(ReservationStatus.OCCUPYING)
                .doesNotContain(ReservationStatus.CANCELLED, ReservationStatus.NO_SHOW);
    }

    @Test
    @DisplayName("상태 문자열은 소문자 값만 허용한다")
    void statusFrom() {
        assertThat(ReservationStatus.from("no_show")).isEqualTo(ReservationStatus.NO_SHOW);

        assertThatThrownBy(() -> ReservationStatus.from("CONFIRMED"))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("pending, confirmed, seated, completed, cancelled, no_show")
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
    }
}
