package personal.rezzy.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code, 에러 분류, 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL, "C006", "서버 내부 오류가 발생했습니다."),

    // Table Domain (Txxx)
    TABLE_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "T001", "테이블을 찾을 수 없습니다."),
    DUPLICATE_TABLE_NUMBER(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "T002", "이미 사용 중인 테이블 번호입니다."),
    TABLE_IN_USE(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "T003", "진행 중인 예약이 있는 테이블입니다."),

    // Hours Domain (Hxxx)
    SPECIAL_HOURS_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "H001", "특별 영업시간을 찾을 수 없습니다."),
    OUTSIDE_OPERATING_HOURS(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "H002", "영업시간 외의 예약 시간입니다."),

    // Booking Domain (Bxxx)
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    TABLE_NOT_AVAILABLE(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "B002", "요청한 시간에 사용할 수 없는 테이블입니다."),
    CONCURRENT_RESERVATION(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "B003", "동시 예약 충돌이 발생했습니다."),
    CONTACT_REQUIRED(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "B004", "이메일 또는 전화번호가 필요합니다."),

    // Storage (Sxxx)
    STORAGE_BUSY(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.STORAGE, "S001", "요청이 몰려 처리하지 못했습니다. 잠시 후 다시 시도해주세요."),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.STORAGE, "S002", "저장소에 연결할 수 없습니다.");

    private final HttpStatus httpStatus;
    private final ErrorKind kind;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, ErrorKind kind, String code, String message) {
        this.httpStatus = httpStatus;
        this.kind = kind;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
