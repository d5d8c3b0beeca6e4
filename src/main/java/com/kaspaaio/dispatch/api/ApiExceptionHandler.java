package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.error.AioException;
import com.kaspaaio.core.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

/**
 * Maps installer exceptions to JSON error bodies of the form {@code {"errors": [...]}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AioException.class)
    ResponseEntity<Map<String, Object>> installerError(AioException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.info("Request rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(body(List.of(e.getError())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body(List.of(
                AioError.validation("bad_request", e.getMessage(), null))));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONCURRENCY -> HttpStatus.CONFLICT;
            case ENGINE -> HttpStatus.BAD_GATEWAY;
            case STORAGE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static Map<String, Object> body(List<AioError> errors) {
        return Map.of("errors", errors);
    }
}
