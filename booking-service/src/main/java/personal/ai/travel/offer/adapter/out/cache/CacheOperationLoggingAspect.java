package personal.ai.travel.offer.adapter.out.cache;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Cache Operation Logging Aspect
 * @Cacheable 메서드의 전체 실행 시간 측정 (캐시 히트/미스 및 직렬화 포함)
 * 검색 조건은 로그에 남기지 않는다
 */
@Slf4j
@Aspect
@Component
public class CacheOperationLoggingAspect {

    @Around("@annotation(org.springframework.cache.annotation.Cacheable)")
    public Object logCacheOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.nanoTime();
        String methodName = joinPoint.getSignature().toShortString();

        try {
            Object result = joinPoint.proceed();
            log.debug("Cached operation completed: method={}, totalTime={}ms",
                    methodName, (System.nanoTime() - startTime) / 1_000_000);
            return result;
        } catch (Throwable e) {
            log.warn("Cached operation failed: method={}, totalTime={}ms, error={}",
                    methodName, (System.nanoTime() - startTime) / 1_000_000, e.getMessage());
            throw e;
        }
    }
}
