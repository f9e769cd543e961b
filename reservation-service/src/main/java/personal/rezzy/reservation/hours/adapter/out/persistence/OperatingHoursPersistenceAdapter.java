package personal.rezzy.reservation.hours.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.hours.application.port.out.OperatingHoursRepository;
import personal.rezzy.reservation.hours.application.port.out.SpecialHoursRepository;
import personal.rezzy.reservation.hours.domain.model.OperatingHours;
import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Operating Hours Persistence Adapter
 * 요일 영업시간과 특별 영업시간 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatingHoursPersistenceAdapter implements OperatingHoursRepository, SpecialHoursRepository {

    private final JpaOperatingHoursRepository jpaOperatingHoursRepository;
    private final JpaSpecialHoursRepository jpaSpecialHoursRepository;

    @Override
    public List<OperatingHours> findAll() {
        return jpaOperatingHoursRepository.findAllByOrderByDayOfWeekAsc().stream()
                .map(OperatingHoursEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<OperatingHours> findByDayOfWeek(int dayOfWeek) {
        log.debug("Finding weekly hours: dayOfWeek={}", dayOfWeek);
        return jpaOperatingHoursRepository.findByDayOfWeek(dayOfWeek)
                .map(OperatingHoursEntity::toDomain);
    }

    @Override
    public OperatingHours save(OperatingHours hours) {
        return jpaOperatingHoursRepository.saveAndFlush(OperatingHoursEntity.fromDomain(hours))
                .toDomain();
    }

    @Override
    public Optional<SpecialHours> findById(UUID specialHoursId) {
        return jpaSpecialHoursRepository.findById(specialHoursId)
                .map(SpecialHoursEntity::toDomain);
    }

    @Override
    public Optional<SpecialHours> findByDate(LocalDate date) {
        log.debug("Finding special hours: date={}", date);
        return jpaSpecialHoursRepository.findBySpecialDate(date)
                .map(SpecialHoursEntity::toDomain);
    }

    @Override
    public List<SpecialHours> findBetween(LocalDate dateFrom, LocalDate dateTo) {
        return jpaSpecialHoursRepository.findBetween(dateFrom, dateTo).stream()
                .map(SpecialHoursEntity::toDomain)
                .toList();
    }

    @Override
    public SpecialHours save(SpecialHours specialHours) {
        return jpaSpecialHoursRepository.saveAndFlush(SpecialHoursEntity.fromDomain(specialHours))
                .toDomain();
    }

    @Override
    public void deleteById(UUID specialHoursId) {
        jpaSpecialHoursRepository.deleteById(specialHoursId);
    }
}
