package personal.rezzy.reservation.hours.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.rezzy.common.exception.BusinessException;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("영업시간 도메인 검증 테스트")
class SpecialHoursTest {

    private static final LocalDate DATE = LocalDate.of(2030, 12, 25);

    @Test
    @DisplayName("휴무일은 시간 값 없이 생성할 수 있다")
    void closedWithoutTimes() {
        assertThatCode(() -> SpecialHours.create(DATE, "Christmas", null, true, null, null, null))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("영업일은 세 시간 값이 모두 필요하다")
    void openRequiresTimes() {
        assertThatThrownBy(() -> SpecialHours.create(DATE, "Christmas", null, false,
                LocalTime.of(11, 0), null, LocalTime.of(20, 0)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("required when open");
    }

    @Test
    @DisplayName("마지막 예약 시각은 마감 시각보다 앞서야 한다")
    void lastReservationBeforeClose() {
        assertThatThrownBy(() -> SpecialHours.create(DATE, "Christmas", null, false,
                LocalTime.of(11, 0), LocalTime.of(20, 0), LocalTime.of(20, 0)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("last_reservation_time must be before close_time");
    }

    @Test
    @DisplayName("요일 영업시간도 같은 순서 규칙을 따른다")
    void operatingHoursOrdering() {
        assertThatThrownBy(() -> OperatingHours.create(0, LocalTime.of(22, 0), LocalTime.of(11, 0), LocalTime.of(21, 0)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("close_time must be after open_time");
    }

    @Test
    @DisplayName("요일 번호는 월요일 0부터 일요일 6까지")
    void dayOfWeekOf() {
        assertThat(OperatingHours.dayOfWeekOf(LocalDate.of(2024, 1, 1))).isZero();  // 월요일
        assertThat(OperatingHours.dayOfWeekOf(LocalDate.of(2024, 1, 7))).isEqualTo(6); // 일요일
    }

    @Test
    @DisplayName("수정해도 ID와 날짜는 유지된다")
    void update_KeepsIdentity() {
        SpecialHours created = SpecialHours.create(DATE, "Christmas", null, true, null, null, null);

        SpecialHours updated = created.update("Christmas Eve dinner", "set menu", false,
                LocalTime.of(17, 0), LocalTime.of(23, 0), LocalTime.of(21, 30));

        assertThat(updated.id()).isEqualTo(created.id());
        assertThat(updated.date()).isEqualTo(DATE);
        assertThat(updated.closed()).isFalse();
    }
}
