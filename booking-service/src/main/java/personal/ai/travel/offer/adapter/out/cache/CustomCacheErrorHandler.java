package personal.ai.travel.offer.adapter.out.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.interceptor.CacheErrorHandler;

/**
 * Custom Cache Error Handler
 * 캐시 장애는 검색 실패로 번지지 않게 로그만 남긴다 (캐시 미스로 처리되어 제공자를 직접 호출)
 */
@Slf4j
public class CustomCacheErrorHandler implements CacheErrorHandler {

    @Override
    public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
        log.warn("Cache GET failed, falling back to provider: cache={}, key={}, error={}",
                cache.getName(), key, exception.getMessage(), exception);
    }

    @Override
    public void handleCachePutError(RuntimeException exception, Cache cache, Object key, Object value) {
        log.warn("Cache PUT failed: cache={}, key={}, valueType={}, error={}",
                cache.getName(), key, value != null ? value.getClass().getSimpleName() : "null",
                exception.getMessage(), exception);
    }

    @Override
    public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
        log.error("Cache EVICT failed: cache={}, key={}, error={}",
                cache.getName(), key, exception.getMessage(), exception);
    }

    @Override
    public void handleCacheClearError(RuntimeException exception, Cache cache) {
        log.error("Cache CLEAR failed: cache={}, error={}", cache.getName(), exception.getMessage(), exception);
    }
}
