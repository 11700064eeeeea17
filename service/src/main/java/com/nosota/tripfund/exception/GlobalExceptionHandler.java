package com.nosota.tripfund.exception;

import com.nosota.tripfund.dto.ErrorResponse;
import com.nosota.tripfund.error.*;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // ==================== 404 ====================

    @ExceptionHandler({
            TripNotFoundException.class,
            ExpenseNotFoundException.class,
            SettlementNotFoundException.class,
            PaymentNotFoundException.class,
            UserNotFoundException.class
    })
    public ResponseEntity<ErrorResponse> handleNotFound(Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Resource not found [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Entity not found [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.NOT_FOUND, "Entity Not Found", ex.getMessage(), request);
    }

    // ==================== 403 ====================

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(
            ForbiddenOperationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Forbidden operation [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request);
    }

    // ==================== 409 ====================

    @ExceptionHandler(SpendWindowClosedException.class)
    public ResponseEntity<ErrorResponse> handleSpendWindowClosed(
            SpendWindowClosedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Spend window closed [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.CONFLICT, "Spend Window Closed", ex.getMessage(), request);
    }

    @ExceptionHandler(ExpenseLockedException.class)
    public ResponseEntity<ErrorResponse> handleExpenseLocked(
            ExpenseLockedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Expense locked [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.CONFLICT, "Expense Locked", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    // ==================== 400 ====================

    @ExceptionHandler(AssignmentMismatchException.class)
    public ResponseEntity<ErrorResponse> handleAssignmentMismatch(
            AssignmentMismatchException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Assignment mismatch [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.BAD_REQUEST, "Assignment Mismatch", ex.getMessage(), request);
    }

    @ExceptionHandler(PaymentExceedsSettlementException.class)
    public ResponseEntity<ErrorResponse> handlePaymentExceedsSettlement(
            PaymentExceedsSettlementException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Payment exceeds settlement [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.BAD_REQUEST, "Payment Exceeds Settlement", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.error("Validation failed [correlationId={}]: {}", correlationId, message);

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler({
            HandlerMethodValidationException.class,
            ConstraintViolationException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Bad request [correlationId={}]: {}", correlationId, ex.getMessage());

        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    // ==================== 500 ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                       HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
