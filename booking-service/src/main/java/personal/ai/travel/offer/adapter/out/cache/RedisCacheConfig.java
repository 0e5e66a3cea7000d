package personal.ai.travel.offer.adapter.out.cache;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import personal.ai.travel.offer.application.service.OfferSearchService;

import java.time.Duration;
import java.util.Set;

/**
 * Redis Cache Configuration
 * 상품 검색 결과(List&lt;Offer&gt;)를 JSON으로 캐시
 *
 * - Offer record는 Serializable 구현 없이 JSON으로 저장
 * - LocalDate 필드를 위해 JavaTimeModule 등록 (ISO 문자열)
 * - CustomCacheErrorHandler: Redis 장애 시 예외 대신 로그 후 제공자 직접 호출
 * - spring.cache.type=redis 일 때만 활성화 (테스트는 none)
 */
@Configuration
@ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis")
public class RedisCacheConfig implements CachingConfigurer {

        @Value("${spring.cache.redis.time-to-live:30000}")
        private long ttlMillis;

        @Bean
        public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory) {
                ObjectMapper objectMapper = new ObjectMapper();
                objectMapper.registerModule(new JavaTimeModule());
                objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

                // record 컴포넌트(필드)만 직렬화, 편의 메서드는 제외
                objectMapper.setVisibility(
                                objectMapper.getSerializationConfig()
                                                .getDefaultVisibilityChecker()
                                                .withFieldVisibility(JsonAutoDetect.Visibility.ANY)
                                                .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                                                .withIsGetterVisibility(JsonAutoDetect.Visibility.NONE));

                // 역직렬화 허용 타입: personal.ai 패키지와 java.util 컬렉션
                BasicPolymorphicTypeValidator ptv = BasicPolymorphicTypeValidator.builder()
                                .allowIfSubType("personal.ai")
                                .allowIfSubType("java.util")
                                .build();

                objectMapper.setDefaultTyping(
                                new RecordSupportingTypeResolver(ObjectMapper.DefaultTyping.NON_FINAL, ptv));

                GenericJackson2JsonRedisSerializer serializer = new GenericJackson2JsonRedisSerializer(objectMapper);

                RedisCacheConfiguration config = RedisCacheConfiguration.defaultCacheConfig()
                                .entryTtl(Duration.ofMillis(ttlMillis))
                                .prefixCacheNameWith("travel:")
                                .serializeKeysWith(
                                                RedisSerializationContext.SerializationPair
                                                                .fromSerializer(new StringRedisSerializer()))
                                .serializeValuesWith(
                                                RedisSerializationContext.SerializationPair.fromSerializer(serializer))
                                .disableCachingNullValues();

                return RedisCacheManager.builder(connectionFactory)
                                .cacheDefaults(config)
                                .initialCacheNames(Set.of(OfferSearchService.CACHE_NAME))
                                .build();
        }

        @Override
        public CacheErrorHandler errorHandler() {
                return new CustomCacheErrorHandler();
        }
}
