package personal.rezzy.common.exception;

/**
 * 에러 분류
 * 호출자가 재시도 여부와 대안 제시 여부를 판단하는 기준
 */
public enum ErrorKind {
    /** 잘못된 입력 - 재시도 불가 */
    VALIDATION,
    /** 참조한 리소스 없음 */
    NOT_FOUND,
    /** 요청한 테이블/시간대 충돌 - 다른 대안 제시 가능 */
    CONFLICT,
    /** 저장소 일시 장애 - 백오프 후 재시도 가능 */
    STORAGE,
    /** 예상하지 못한 서버 오류 */
    INTERNAL
}
