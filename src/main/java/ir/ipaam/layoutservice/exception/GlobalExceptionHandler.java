package ir.ipaam.layoutservice.exception;

import ir.ipaam.layoutservice.domain.exception.InvalidStyleException;
import ir.ipaam.layoutservice.domain.exception.LayoutException;
import ir.ipaam.layoutservice.domain.exception.MalformedTableException;
import ir.ipaam.layoutservice.domain.exception.PaginationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.UUID;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed");
        log.warn("Validation error [{}]: {}", errorId, message);
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleMalformedInput(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR,
                "Malformed request: " + ex.getMessage(), null, request);
    }

    @ExceptionHandler(LayoutException.class)
    public ResponseEntity<ApiError> handleLayout(LayoutException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        Integer completed = null;
        LayoutException cause = ex;
        if (ex instanceof PaginationException pagination) {
            completed = pagination.getCompletedPages().size();
            cause = pagination.getCause();
        }
        String code;
        if (cause instanceof InvalidStyleException) {
            code = ApiError.INVALID_STYLE;
        } else if (cause instanceof MalformedTableException) {
            code = ApiError.MALFORMED_TABLE;
        } else {
            code = ApiError.LAYOUT_FAILED;
        }
        log.error("Layout failed [{}] after {} pages: {}", errorId, completed, cause.getMessage(), ex);
        return build(HttpStatus.UNPROCESSABLE_ENTITY, errorId, code, cause.getMessage(), completed, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", null, request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String errorId, String code, String message,
                                           Integer completedPages, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ApiError.builder()
                        .errorId(errorId)
                        .code(code)
                        .message(message)
                        .completedPages(completedPages)
                        .path(request.getRequestURI())
                        .timestamp(Instant.now())
                        .build());
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
