package personal.rezzy.reservation.hours.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.hours.application.port.out.OperatingHoursRepository;
import personal.rezzy.reservation.hours.application.port.out.SpecialHoursRepository;
import personal.rezzy.reservation.hours.domain.exception.OutsideOperatingHoursException;
import personal.rezzy.reservation.hours.domain.model.EffectiveHours;
import personal.rezzy.reservation.hours.domain.model.HoursSource;
import personal.rezzy.reservation.hours.domain.model.OperatingHours;

import java.time.LocalDate;

/**
 * Operating Hours Resolver (Domain Service)
 * 특별 영업시간 → 요일 영업시간 → 휴무 순으로 날짜의 영업시간을 결정한다.
 * 저장소에서 직접 읽으며 캐시를 거치지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatingHoursResolver {

    private final OperatingHoursRepository operatingHoursRepository;
    private final SpecialHoursRepository specialHoursRepository;

    public EffectiveHours resolve(LocalDate date) {
        return specialHoursRepository.findByDate(date)
                .map(EffectiveHours::of)
                .orElseGet(() -> resolveRegular(date));
    }

    /**
     * 영업시간 안의 예약 시간인지 검증
     *
     * @throws OutsideOperatingHoursException 휴무일이거나 영업시간 밖인 경우
     */
    public EffectiveHours requireAdmitted(TimeWindow window) {
        EffectiveHours hours = resolve(window.date());
        if (!hours.admits(window)) {
            log.warn("Reservation time rejected: date={}, start={}, duration={}, open={}, source={}",
                    window.date(), window.startTime(), window.durationMinutes(), hours.open(), hours.source());
            throw new OutsideOperatingHoursException(window, hours);
        }
        return hours;
    }

    private EffectiveHours resolveRegular(LocalDate date) {
        return operatingHoursRepository.findByDayOfWeek(OperatingHours.dayOfWeekOf(date))
                .map(regular -> EffectiveHours.of(date, regular))
                .orElseGet(() -> EffectiveHours.closed(date, HoursSource.NONE));
    }
}
