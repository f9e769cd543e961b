package personal.rezzy.reservation.table.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TableSchedule 단위 테스트")
class TableScheduleTest {

    private static final LocalDate DATE = LocalDate.of(2030, 5, 10);

    private static TableUsage usage(int partySize, String start, String end) {
        return new TableUsage(UUID.randomUUID(), partySize,
                LocalDateTime.of(DATE, LocalTime.parse(start)),
                LocalDateTime.of(DATE, LocalTime.parse(end)));
    }

    @Test
    @DisplayName("예약이 없으면 어떤 설정으로도 바꿀 수 있다")
    void empty() {
        TableSchedule schedule = new TableSchedule(List.of());

        assertThat(schedule.peakPartySize()).isZero();
        assertThat(schedule.conflictWith(1, false)).isNull();
    }

    @Test
    @DisplayName("끝나는 시각에 시작하는 예약은 겹치지 않는다")
    void backToBack() {
        TableSchedule schedule = new TableSchedule(List.of(
                usage(4, "18:00", "19:30"),
                usage(3, "19:30", "21:00")));

        assertThat(schedule.hasOverlappingUsages()).isFalse();
        assertThat(schedule.peakPartySize()).isEqualTo(4);
        assertThat(schedule.conflictWith(4, false)).isNull();
    }

    @Test
    @DisplayName("겹치는 구간에서는 인원을 합산한다")
    void overlappingSums() {
        // given: 18:30-19:30 에 3 + 4 + 1
        TableSchedule schedule = new TableSchedule(List.of(
                usage(3, "18:00", "19:30"),
                usage(4, "18:30", "20:00"),
                usage(1, "19:00", "19:45"),
                usage(2, "20:00", "21:00")));

        // then
        assertThat(schedule.peakPartySize()).isEqualTo(8);
        assertThat(schedule.peakReservationCount()).isEqualTo(3);
        assertThat(schedule.conflictWith(8, true)).isNull();
        assertThat(schedule.conflictWith(7, true)).isEqualTo("booked occupancy 8 exceeds new max_capacity 7");
    }

    @Test
    @DisplayName("겹치는 예약이 있으면 비공유로 바꿀 수 없다")
    void unshareRejected() {
        TableSchedule schedule = new TableSchedule(List.of(
                usage(2, "18:00", "19:30"),
                usage(2, "19:00", "20:30")));

        assertThat(schedule.conflictWith(8, false)).contains("non-shared");
    }
}
