package com.sandcastle.dispatch.api;

import com.sandcastle.core.error.ErrorKind;
import com.sandcastle.core.error.SandcastleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to {@code {"error": {"kind": ..., "message": ...}}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SandcastleException.class)
    public ResponseEntity<Map<String, Object>> handleSandcastle(SandcastleException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.warn("{}: {}", e.getKind().tag(), e.getMessage());
        } else {
            log.debug("{}: {}", e.getKind().tag(), e.getMessage());
        }
        return ResponseEntity.status(status).body(errorBody(e.getKind().tag(), e.getMessage()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(errorBody(ErrorKind.VALIDATION.tag(), e.getMessage()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SESSION_BUSY, PROCESS_CRASH -> HttpStatus.CONFLICT;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case SPAWN -> HttpStatus.SERVICE_UNAVAILABLE;
            case STORAGE -> HttpStatus.BAD_GATEWAY;
            case SECURITY_VIOLATION -> HttpStatus.FORBIDDEN;
            case CAPACITY_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
        };
    }

    static Map<String, Object> errorBody(String kind, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", kind);
        error.put("message", message == null ? "" : message);
        return Map.of("error", error);
    }
}
