package personal.ai.travel.offer.adapter.out.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClient Configuration
 * 외부 상품 제공자 호출용 RestClient
 *
 * Timeout 전략:
 * - Connect Timeout: TCP 연결 실패 빠른 감지
 * - Read Timeout: Circuit Breaker Slow Call 기준과 일치, 초과 시 ProviderTimeoutException
 */
@Configuration
@ConditionalOnProperty(name = "external.offer-provider.mode", havingValue = "rest", matchIfMissing = true)
public class RestClientConfig {

    static final String API_KEY_HEADER = "X-Api-Key";

    @Value("${external.offer-provider.base-url}")
    private String offerProviderBaseUrl;

    @Value("${external.offer-provider.api-key:}")
    private String apiKey;

    @Value("${external.offer-provider.connect-timeout-ms:500}")
    private int connectTimeoutMs;

    @Value("${external.offer-provider.read-timeout-ms:2000}")
    private int readTimeoutMs;

    @Bean
    public RestClient offerProviderRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(offerProviderBaseUrl)
                .requestFactory(requestFactory);
        if (!apiKey.isBlank()) {
            builder.defaultHeader(API_KEY_HEADER, apiKey);
        }
        return builder.build();
    }
}
