package personal.rezzy.common.exception;

import lombok.Getter;

/**
 * 비즈니스 규칙 위반 예외의 최상위 클래스
 * 메시지에는 엔티티와 ID 등 운영 컨텍스트를 담는다
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}
