package personal.ai.travel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

/**
 * Travel Booking Service Application
 * 이벤트 저장소, 예약 조회 모델, 커맨드 처리, 상품 검색을 포함하는 예약 쓰기 경로 서비스
 */
@EnableCaching     // 상품 검색 결과 캐시 (spring.cache.type으로 Redis/none 전환)
@SpringBootApplication(
    scanBasePackages = {
        "personal.ai.travel",
        "personal.ai.common"  // common 모듈의 GlobalExceptionHandler, HealthCheckService 스캔
    }
)
public class TravelBookingApplication {
    public static void main(String[] args) {
        SpringApplication.run(TravelBookingApplication.class, args);
    }
}
