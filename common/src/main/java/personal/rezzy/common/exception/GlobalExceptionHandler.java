package personal.rezzy.common.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 전역 예외 처리 핸들러
 * 모든 실패는 ErrorResponse(code, kind, message)로 변환되며, 변환 전에 로그를 남긴다
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

        @ExceptionHandler(BusinessException.class)
        public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
                ErrorCode errorCode = e.getErrorCode();
                log.warn("Business exception occurred: code={}, kind={}, detail={}",
                                errorCode.getCode(), errorCode.getKind(), e.getMessage());

                return toResponse(errorCode, e.getMessage());
        }

        @ExceptionHandler(NoResourceFoundException.class)
        public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
                log.warn("Resource not found: {}", e.getResourcePath());
                return toResponse(ErrorCode.NOT_FOUND, "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath());
        }

        @ExceptionHandler(MethodArgumentNotValidException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
                log.warn("Validation failed: {}", e.getMessage());
                String message = "입력값이 유효하지 않습니다.";
                if (!e.getBindingResult().getAllErrors().isEmpty()) {
                        message = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
                }
                return toResponse(ErrorCode.INVALID_INPUT, message);
        }

        @ExceptionHandler(HandlerMethodValidationException.class)
        public ResponseEntity<ErrorResponse> handleHandlerMethodValidationException(HandlerMethodValidationException e) {
                log.warn("Parameter validation failed: {}", e.getMessage());
                String message = "입력값이 유효하지 않습니다.";
                if (!e.getAllErrors().isEmpty()) {
                        message = e.getAllErrors().get(0).getDefaultMessage();
                }
                return toResponse(ErrorCode.INVALID_INPUT, message);
        }

        @ExceptionHandler(ConstraintViolationException.class)
        public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
                log.warn("Constraint violation: {}", e.getMessage());
                return toResponse(ErrorCode.INVALID_INPUT, e.getMessage());
        }

        @ExceptionHandler(MissingServletRequestParameterException.class)
        public ResponseEntity<ErrorResponse> handleMissingServletRequestParameterException(
                        MissingServletRequestParameterException e) {
                log.warn("Missing parameter: {}", e.getParameterName());
                return toResponse(ErrorCode.INVALID_INPUT, "필수 파라미터가 누락되었습니다: " + e.getParameterName());
        }

        @ExceptionHandler(MethodArgumentTypeMismatchException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(
                        MethodArgumentTypeMismatchException e) {
                log.warn("Type mismatch: parameter={}, value={}", e.getName(), e.getValue());
                return toResponse(ErrorCode.INVALID_INPUT,
                                "파라미터 형식이 올바르지 않습니다: " + e.getName() + "=" + e.getValue());
        }

        @ExceptionHandler(HttpMessageNotReadableException.class)
        public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
                log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
                return toResponse(ErrorCode.INVALID_INPUT, "요청 본문을 해석할 수 없습니다.");
        }

        /**
         * 서비스 계층에서 변환되지 않은 유니크 제약 위반 (최후 방어선)
         */
        @ExceptionHandler(DataIntegrityViolationException.class)
        public ResponseEntity<ErrorResponse> handleDataIntegrityViolationException(DataIntegrityViolationException e) {
                log.warn("Data integrity violation: {}", e.getMostSpecificCause().getMessage());
                return toResponse(ErrorCode.CONFLICT, ErrorCode.CONFLICT.getMessage());
        }

        /**
         * 락 대기 시간 초과, 쿼리 타임아웃 등 재시도 가능한 저장소 실패
         */
        @ExceptionHandler({TransientDataAccessException.class, TransactionTimedOutException.class})
        public ResponseEntity<ErrorResponse> handleTransientStorageFailure(Exception e) {
                log.warn("Transient storage failure: type={}, message={}", e.getClass().getSimpleName(), e.getMessage());
                return toResponse(ErrorCode.STORAGE_BUSY, ErrorCode.STORAGE_BUSY.getMessage());
        }

        @ExceptionHandler({DataAccessException.class, CannotCreateTransactionException.class})
        public ResponseEntity<ErrorResponse> handleStorageFailure(Exception e) {
                log.error("Storage failure", e);
                return toResponse(ErrorCode.STORAGE_UNAVAILABLE, ErrorCode.STORAGE_UNAVAILABLE.getMessage());
        }

        @ExceptionHandler(Exception.class)
        public ResponseEntity<ErrorResponse> handleException(Exception e) {
                log.error("Unexpected exception occurred", e);
                return toResponse(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
        }

        private ResponseEntity<ErrorResponse> toResponse(ErrorCode errorCode, String message) {
                return ResponseEntity
                                .status(errorCode.getHttpStatus())
                                .body(ErrorResponse.of(errorCode, message));
        }
}
