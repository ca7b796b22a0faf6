package quest.gekko.insights.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.insights.service.error.ErrorKind;
import quest.gekko.insights.service.error.PageInsightsException;
import quest.gekko.insights.web.dto.ApiError;

import java.time.Instant;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    @ExceptionHandler(PageInsightsException.class)
    public ResponseEntity<ApiError> handlePageInsightsException(PageInsightsException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.kind());
        if (status.is5xxServerError()) {
            log.error("{} for URL: {}", ex.kind(), request.getRequestURL(), ex);
        } else {
            log.warn("{}: {} for URL: {}", ex.kind(), ex.getMessage(), request.getRequestURL());
        }
        return build(ex.kind(), status, ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return build(ErrorKind.INVALID_ARGUMENT, HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Invalid request body: {} for URL: {}", message, request.getRequestURL());
        return build(ErrorKind.INVALID_ARGUMENT, HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiError> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        String message = ex instanceof HttpMessageNotReadableException ? "Request body is not readable" : ex.getMessage();
        return build(ErrorKind.INVALID_ARGUMENT, HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return build(ErrorKind.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ACQUISITION_FAILED -> HttpStatus.BAD_GATEWAY;
            case TRANSIENT_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
            case STORAGE_FAILURE, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ApiError> build(ErrorKind kind, HttpStatus status, String message, HttpServletRequest request) {
        ApiError body = new ApiError(kind, message, status.value(), request.getRequestURI(), Instant.now());
        return ResponseEntity.status(status).body(body);
    }
}
