package personal.rezzy.reservation.hours.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.rezzy.reservation.hours.domain.model.EffectiveHours;
import personal.rezzy.reservation.hours.domain.service.OperatingHoursResolver;

import java.time.LocalDate;

/**
 * Effective Hours Cache Service
 *
 * Spring AOP 프록시를 위해 별도 컴포넌트로 분리 (Self-invocation 문제 해결)
 *
 * 캐시 전략:
 * - 조회: 가용성 조회 API에서 날짜별 영업시간을 @Cacheable로 캐싱
 * - 무효화: 요일/특별 영업시간이 바뀌면 전체 무효화
 * - 예약 트랜잭션은 이 캐시를 쓰지 않고 OperatingHoursResolver로 직접 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EffectiveHoursCacheService {

    public static final String CACHE_NAME = "effectiveHours";

    private final OperatingHoursResolver operatingHoursResolver;

    @Transactional(readOnly = true)
    @Cacheable(value = CACHE_NAME, key = "#date.toString()")
    public EffectiveHours resolve(LocalDate date) {
        log.debug("Cache MISS - Resolving effective hours from DB: date={}", date);
        return operatingHoursResolver.resolve(date);
    }

    @CacheEvict(value = CACHE_NAME, allEntries = true)
    public void evictAll() {
        log.debug("Evicting all effectiveHours cache entries");
    }
}
