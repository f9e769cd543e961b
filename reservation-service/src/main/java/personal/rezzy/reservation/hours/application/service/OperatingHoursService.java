package personal.rezzy.reservation.hours.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import personal.rezzy.reservation.hours.application.port.in.GetOperatingHoursUseCase;
import personal.rezzy.reservation.hours.application.port.in.ManageOperatingHoursUseCase;
import personal.rezzy.reservation.hours.application.port.in.SetOperatingHoursCommand;
import personal.rezzy.reservation.hours.application.port.in.SetSpecialHoursCommand;
import personal.rezzy.reservation.hours.application.port.out.OperatingHoursRepository;
import personal.rezzy.reservation.hours.application.port.out.SpecialHoursRepository;
import personal.rezzy.reservation.hours.domain.exception.SpecialHoursNotFoundException;
import personal.rezzy.reservation.hours.domain.model.EffectiveHours;
import personal.rezzy.reservation.hours.domain.model.OperatingHours;
import personal.rezzy.reservation.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Operating Hours Application Service
 * 요일/특별 영업시간 관리와 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperatingHoursService implements ManageOperatingHoursUseCase, GetOperatingHoursUseCase {

    private final OperatingHoursRepository operatingHoursRepository;
    private final SpecialHoursRepository specialHoursRepository;
    private final EffectiveHoursCacheService effectiveHoursCacheService;

    @Override
    @Transactional
    public OperatingHours setWeeklyHours(SetOperatingHoursCommand command) {
        OperatingHours hours = operatingHoursRepository.findByDayOfWeek(command.dayOfWeek())
                .map(existing -> existing.update(
                        command.openTime(), command.closeTime(), command.lastReservationTime()))
                .orElseGet(() -> OperatingHours.create(
                        command.dayOfWeek(), command.openTime(), command.closeTime(),
                        command.lastReservationTime()));

        OperatingHours saved = operatingHoursRepository.save(hours);
        evictEffectiveHoursAfterCommit();

        log.info("Weekly hours set: dayOfWeek={}, open={}, lastReservation={}, close={}",
                saved.dayOfWeek(), saved.openTime(), saved.lastReservationTime(), saved.closeTime());
        return saved;
    }

    @Override
    @Transactional
    public SpecialHours setSpecialHours(SetSpecialHoursCommand command) {
        SpecialHours specialHours = specialHoursRepository.findByDate(command.date())
                .map(existing -> existing.update(
                        command.name(), command.description(), command.closed(),
                        command.openTime(), command.closeTime(), command.lastReservationTime()))
                .orElseGet(() -> SpecialHours.create(
                        command.date(), command.name(), command.description(), command.closed(),
                        command.openTime(), command.closeTime(), command.lastReservationTime()));

        SpecialHours saved = specialHoursRepository.save(specialHours);
        evictEffectiveHoursAfterCommit();

        log.info("Special hours set: date={}, name={}, closed={}", saved.date(), saved.name(), saved.closed());
        return saved;
    }

    @Override
    @Transactional
    public void deleteSpecialHours(UUID specialHoursId) {
        SpecialHours specialHours = specialHoursRepository.findById(specialHoursId)
                .orElseThrow(() -> new SpecialHoursNotFoundException(specialHoursId));

        specialHoursRepository.deleteById(specialHoursId);
        evictEffectiveHoursAfterCommit();

        log.info("Special hours deleted: specialHoursId={}, date={}", specialHoursId, specialHours.date());
    }

    @Override
    @Transactional(readOnly = true)
    public List<OperatingHours> getWeeklyHours() {
        return operatingHoursRepository.findAll();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SpecialHours> getSpecialHours(LocalDate dateFrom, LocalDate dateTo) {
        log.debug("Getting special hours: dateFrom={}, dateTo={}", dateFrom, dateTo);
        return specialHoursRepository.findBetween(dateFrom, dateTo);
    }

    @Override
    @Transactional(readOnly = true)
    public SpecialHours getSpecialHours(LocalDate date) {
        return specialHoursRepository.findByDate(date)
                .orElseThrow(() -> new SpecialHoursNotFoundException(date));
    }

    @Override
    public EffectiveHours getEffectiveHours(LocalDate date) {
        return effectiveHoursCacheService.resolve(date);
    }

    /**
     * 영업시간 캐시 무효화는 트랜잭션 커밋 이후에 수행한다.
     */
    private void evictEffectiveHoursAfterCommit() {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            effectiveHoursCacheService.evictAll();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                effectiveHoursCacheService.evictAll();
            }
        });
    }
}
