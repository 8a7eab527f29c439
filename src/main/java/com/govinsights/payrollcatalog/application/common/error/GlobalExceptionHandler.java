package com.govinsights.payrollcatalog.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * 전역 예외 처리기.
 *
 * <p>관리자 ingest/진단 API에서 발생한 예외를 {@link ErrorResponse} 형태로 변환하여 반환한다.</p>
 * <ul>
 *     <li>{@link StructuralException} → 400 STRUCTURE_ERROR</li>
 *     <li>{@link NotFoundException} → 404 (예외의 code)</li>
 *     <li>요청 검증/해석 실패 → 400 VALIDATION_ERROR</li>
 *     <li>DB 오류 → 500 DB_ERROR, 그 외 → 500 INTERNAL_ERROR</li>
 * </ul>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(StructuralException.class)
    public ResponseEntity<ErrorResponse> handleStructural(StructuralException e, ServerWebExchange ex) {
        log.warn("Structural error on {}: {}", pathOf(ex), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.code(), ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e, ServerWebExchange ex) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), e.code(), ex);
    }

    /**
     * 필드 제약 위반(경로 변수 등)을 400으로 변환한다. 메시지는 첫 번째 위반만 담는다.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e, ServerWebExchange ex) {
        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");
        return respond(HttpStatus.BAD_REQUEST, msg, VALIDATION_ERROR, ex);
    }

    /**
     * 요청 바디 검증 실패를 400으로 변환한다. 메시지는 {@code 필드명: 사유} 형식.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e, ServerWebExchange ex) {
        String msg = e.getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .orElse("Validation failed");
        return respond(HttpStatus.BAD_REQUEST, msg, VALIDATION_ERROR, ex);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException e, ServerWebExchange ex) {
        String msg = e.getAllErrors().stream()
                .findFirst()
                .map(err -> String.valueOf(err.getDefaultMessage()))
                .orElse("Validation failed");
        return respond(HttpStatus.BAD_REQUEST, msg, VALIDATION_ERROR, ex);
    }

    /** 바디 없음, 잘못된 JSON, 타입 불일치 */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e, ServerWebExchange ex) {
        return respond(HttpStatus.BAD_REQUEST, e.getReason(), VALIDATION_ERROR, ex);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDb(DataAccessException e, ServerWebExchange ex) {
        log.error("Database error on {}", pathOf(ex), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Database error", "DB_ERROR", ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, ServerWebExchange ex) {
        log.error("Unexpected error on {}", pathOf(ex), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", "INTERNAL_ERROR", ex);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String code, ServerWebExchange ex) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), status.getReasonPhrase(), message, pathOf(ex), code));
    }

    private static String pathOf(ServerWebExchange ex) {
        return ex.getRequest().getPath().value();
    }
}
