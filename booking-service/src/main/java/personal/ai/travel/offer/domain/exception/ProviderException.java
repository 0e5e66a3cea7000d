package personal.ai.travel.offer.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Provider Exception
 * 외부 상품 제공자 장애. 코어에서 자동 재시도하지 않고 호출자에게 전달한다
 */
public class ProviderException extends BusinessException {

    public ProviderException(String detail) {
        super(ErrorCode.PROVIDER_ERROR, detail);
    }

    public ProviderException(String detail, Throwable cause) {
        super(ErrorCode.PROVIDER_ERROR, detail, cause);
    }

    protected ProviderException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }
}
