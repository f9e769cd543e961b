package personal.rezzy.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.rezzy.reservation.booking.application.config.BookingProperties;
import personal.rezzy.reservation.booking.application.port.in.AvailabilityQuery;
import personal.rezzy.reservation.booking.application.port.in.AvailabilityResult;
import personal.rezzy.reservation.booking.application.port.in.CheckAvailabilityUseCase;
import personal.rezzy.reservation.booking.application.port.out.TableOccupancyRepository;
import personal.rezzy.reservation.booking.domain.model.AvailableTable;
import personal.rezzy.reservation.booking.domain.model.TimeWindow;
import personal.rezzy.reservation.booking.domain.service.AvailabilityCalculator;
import personal.rezzy.reservation.hours.application.service.EffectiveHoursCacheService;
import personal.rezzy.reservation.hours.domain.model.EffectiveHours;
import personal.rezzy.reservation.table.application.port.out.TableRepository;

import java.util.List;

/**
 * Availability Query Service
 * 조회 전용. 영업시간은 캐시를 사용하고 테이블 락은 잡지 않는다.
 * 실제 예약 시점의 가용성은 BookingManager가 락을 잡은 뒤 다시 확인한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService implements CheckAvailabilityUseCase {

    private final EffectiveHoursCacheService effectiveHoursCacheService;
    private final TableRepository tableRepository;
    private final TableOccupancyRepository tableOccupancyRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final BookingProperties bookingProperties;

    @Override
    @Transactional(readOnly = true)
    public AvailabilityResult checkAvailability(AvailabilityQuery query) {
        TimeWindow window = query.window(bookingProperties.defaultDurationMinutes());

        EffectiveHours hours = effectiveHoursCacheService.resolve(window.date());
        if (!hours.admits(window)) {
            log.debug("Availability requested outside operating hours: date={}, start={}, source={}",
                    window.date(), window.startTime(), hours.source());
            return AvailabilityResult.invalidTime();
        }

        List<AvailableTable> available = availabilityCalculator.findAvailable(
                tableRepository.findFitting(query.partySize()),
                tableOccupancyRepository.findOccupying(window.date()),
                query.partySize(),
                window);

        log.debug("Found {} available tables: partySize={}, date={}, start={}",
                available.size(), query.partySize(), window.date(), window.startTime());
        return AvailabilityResult.of(available);
    }
}
