package lab.guardian.common;

import jakarta.servlet.http.HttpServletRequest;
import lab.guardian.adapter.store.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.regex.Pattern;

/**
 * Framework-level failures: unreadable bodies, bad or missing parameters, store errors and anything
 * unexpected. Domain errors are mapped by {@code ApiExceptionHandler}, which runs first.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("0x[a-fA-F0-9]{64,}");

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = "Invalid value '%s' for parameter '%s'".formatted(ex.getValue(), ex.getName());
        return ResponseEntity.badRequest().body(ErrorResponse.validation(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + sanitizeMessage(detail);
        }
        return ResponseEntity.badRequest()
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(ErrorResponse.validation(message));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.validation("Missing required query parameter: " + ex.getParameterName()));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<RuntimeErrorResponse> handleStoreException(StoreException ex, HttpServletRequest request) {
        log.error("event=store.request_failed path={} storeStatus={} error={}", request.getRequestURI(), ex.getStatus(), sanitizeMessage(ex.getMessage()));
        return runtimeError("Store request failed", request);
    }

    @ExceptionHandler({IllegalStateException.class, RuntimeException.class})
    public ResponseEntity<RuntimeErrorResponse> handleRuntimeException(Exception ex, HttpServletRequest request) {
        log.error("event=request.unhandled_error path={} type={}", request.getRequestURI(), ex.getClass().getSimpleName(), ex);
        return runtimeError(sanitizeMessage(ex.getMessage()), request);
    }

    private ResponseEntity<RuntimeErrorResponse> runtimeError(String message, HttpServletRequest request) {
        RuntimeErrorResponse body = new RuntimeErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                message,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("0x[REDACTED]");
    }

    public record ErrorResponse(
            String message,
            String code
    ) {
        public static ErrorResponse validation(String message) {
            return new ErrorResponse(message, "VALIDATION_ERROR");
        }
    }

    public record RuntimeErrorResponse(
            int status,
            String message,
            String path
    ) {
    }
}
