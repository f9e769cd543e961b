package personal.rezzy.reservation.hours.adapter.out.cache;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Cache Operation Logging Aspect
 *
 * @Cacheable 메서드의 전체 실행 시간 측정 (캐시 히트면 역직렬화 시간, 미스면 DB 조회 포함)
 * 인자 값 대신 타입만 로깅한다.
 */
@Slf4j
@Aspect
@Component
public class CacheOperationLoggingAspect {

    @Around("@annotation(org.springframework.cache.annotation.Cacheable)")
    public Object logCacheOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.nanoTime();
        String methodName = joinPoint.getSignature().toShortString();
        String argTypes = describeArgs(joinPoint.getArgs());

        try {
            Object result = joinPoint.proceed();
            log.debug("Cache operation completed: method={}, argTypes={}, totalTime={}ms",
                    methodName, argTypes, elapsedMillis(startTime));
            return result;
        } catch (Throwable e) {
            log.error("Cache operation failed: method={}, argTypes={}, totalTime={}ms, error={}",
                    methodName, argTypes, elapsedMillis(startTime), e.getMessage(), e);
            throw e;
        }
    }

    private long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private String describeArgs(Object[] args) {
        if (args == null || args.length == 0) {
            return "[]";
        }
        return Arrays.stream(args)
                .map(arg -> arg == null ? "null" : arg.getClass().getSimpleName())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
