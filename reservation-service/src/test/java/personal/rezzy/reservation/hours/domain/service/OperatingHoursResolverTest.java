package personal.rezzy.reservation.hours.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.hours.application.port.out.OperatingHoursRepository;
import personal.rezzy.reservation.hours.application.port.out.SpecialHoursRepository;
import personal.rezzy.reservation.hours.domain.exception.OutsideOperatingHoursException;
import personal.rezzy.reservation.hours.domain.model.EffectiveHours;
import personal.rezzy.reservation.hours.domain.model.HoursSource;
import personal.rezzy.reservation.hours.domain.model.OperatingHours;
import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OperatingHoursResolver 단위 테스트")
class OperatingHoursResolverTest {

    private static final LocalDate DATE = LocalDate.of(2030, 5, 10);
    private static final int DAY = OperatingHours.dayOfWeekOf(DATE);

    @Mock
    private OperatingHoursRepository operatingHoursRepository;

    @Mock
    private SpecialHoursRepository specialHoursRepository;

    @InjectMocks
    private OperatingHoursResolver resolver;

    @Test
    @DisplayName("특별 영업시간이 요일 영업시간보다 우선한다")
    void specialOverridesRegular() {
        // given
        given(specialHoursRepository.findByDate(DATE)).willReturn(Optional.of(
                SpecialHours.create(DATE, "Private event", null, true, null, null, null)));

        // when
        EffectiveHours hours = resolver.resolve(DATE);

        // then
        assertThat(hours.open()).isFalse();
        assertThat(hours.source()).isEqualTo(HoursSource.SPECIAL);
        verify(operatingHoursRepository, never()).findByDayOfWeek(anyInt());
    }

    @Test
    @DisplayName("특별 영업시간이 없으면 요일 영업시간을 사용한다")
    void regular() {
        given(specialHoursRepository.findByDate(DATE)).willReturn(Optional.empty());
        given(operatingHoursRepository.findByDayOfWeek(DAY)).willReturn(Optional.of(
                OperatingHours.create(DAY, LocalTime.of(11, 0), LocalTime.of(22, 0), LocalTime.of(21, 0))));

        EffectiveHours hours = resolver.resolve(DATE);

        assertThat(hours.open()).isTrue();
        assertThat(hours.source()).isEqualTo(HoursSource.REGULAR);
        assertThat(hours.closeTime()).isEqualTo(LocalTime.of(22, 0));
    }

    @Test
    @DisplayName("영업시간 정보가 전혀 없는 날에 예약하면 OutsideOperatingHoursException")
    void requireAdmitted_NoHours() {
        // given
        given(specialHoursRepository.findByDate(DATE)).willReturn(Optional.empty());
        given(operatingHoursRepository.findByDayOfWeek(DAY)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> resolver.requireAdmitted(new TimeWindow(DATE, LocalTime.of(12, 0), 60)))
                .isInstanceOf(OutsideOperatingHoursException.class)
                .hasMessageContaining("Restaurant is closed")
                .hasMessageContaining("NONE");
    }

    @Test
    @DisplayName("마감 이후에 끝나는 예약은 OutsideOperatingHoursException")
    void requireAdmitted_EndsAfterClose() {
        given(specialHoursRepository.findByDate(DATE)).willReturn(Optional.empty());
        given(operatingHoursRepository.findByDayOfWeek(DAY)).willReturn(Optional.of(
                OperatingHours.create(DAY, LocalTime.of(11, 0), LocalTime.of(22, 0), LocalTime.of(21, 0))));

        assertThatThrownBy(() -> resolver.requireAdmitted(new TimeWindow(DATE, LocalTime.of(21, 0), 90)))
                .isInstanceOf(OutsideOperatingHoursException.class)
                .hasMessageContaining("outside restaurant operating hours");
    }
}
