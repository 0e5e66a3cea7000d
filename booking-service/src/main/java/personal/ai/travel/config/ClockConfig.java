package personal.ai.travel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 소스 설정
 * 이벤트 타임스탬프와 날짜 검증은 모두 이 Clock을 통해 읽는다 (테스트에서 고정 시각으로 교체 가능)
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
