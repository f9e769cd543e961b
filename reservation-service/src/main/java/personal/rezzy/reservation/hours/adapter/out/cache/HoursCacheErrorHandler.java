package personal.rezzy.reservation.hours.adapter.out.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.interceptor.CacheErrorHandler;

/**
 * 영업시간 캐시 오류 처리기
 * <p>
 * Redis가 응답하지 않아도 예약/가용성 요청은 실패하지 않는다.
 * 조회·저장 실패는 캐시를 건너뛰고 저장소의 영업시간을 그대로 사용한다.
 * 무효화 실패는 TTL이 지날 때까지 이전 영업시간이 남으므로 날짜 키와 함께 남긴다.
 */
@Slf4j
public class HoursCacheErrorHandler implements CacheErrorHandler {

    @Override
    public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
        log.warn("Effective hours cache read failed, resolving from store: cache={}, date={}, error={}",
                cache.getName(), key, exception.getMessage());
    }

    @Override
    public void handleCachePutError(RuntimeException exception, Cache cache, Object key, Object value) {
        log.warn("Effective hours cache write skipped: cache={}, date={}, error={}",
                cache.getName(), key, exception.getMessage());
    }

    @Override
    public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
        logStaleEntries(cache, String.valueOf(key), exception);
    }

    @Override
    public void handleCacheClearError(RuntimeException exception, Cache cache) {
        logStaleEntries(cache, "*", exception);
    }

    private void logStaleEntries(Cache cache, String dates, RuntimeException exception) {
        log.error("Effective hours cache eviction failed, stale hours served until TTL: cache={}, dates={}",
                cache.getName(), dates, exception);
    }
}
