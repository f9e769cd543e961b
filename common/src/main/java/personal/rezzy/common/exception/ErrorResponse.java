package personal.rezzy.common.exception;

import java.time.LocalDateTime;

/**
 * 에러 응답 포맷
 *
 * @param code      기계 판독용 에러 코드 (예: B002)
 * @param kind      에러 분류 (VALIDATION, NOT_FOUND, CONFLICT, STORAGE, INTERNAL)
 * @param message   사람이 읽는 메시지
 * @param timestamp 발생 시각
 */
public record ErrorResponse(
        String code,
        ErrorKind kind,
        String message,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getKind(), message, LocalDateTime.now());
    }
}
