package personal.ai.travel.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * H2 인메모리 DB와 고정 응답 OfferProvider로 실제 HTTP 경로를 테스트
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({ TestOfferProviderConfig.class, BookingHttpAdapter.class, BookingTestContext.class })
public class CucumberSpringConfiguration {
}
