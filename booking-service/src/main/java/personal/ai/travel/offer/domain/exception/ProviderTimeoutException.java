package personal.ai.travel.offer.domain.exception;

import personal.ai.common.exception.ErrorCode;

/**
 * Provider Timeout Exception
 * 제공자 호출이 연결/응답 타임아웃을 넘긴 경우
 */
public class ProviderTimeoutException extends ProviderException {
    public ProviderTimeoutException(String operation, Throwable cause) {
        super(ErrorCode.PROVIDER_TIMEOUT,
                String.format("Offer provider timed out: operation=%s", operation), cause);
    }
}
