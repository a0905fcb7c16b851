package com.realtime.messenger.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionAdvice {

    @ExceptionHandler(MessengerException.class)
    public ResponseEntity<Map<String, Object>> handle(MessengerException e) {
        if (e.getKind() == ErrorKind.TRANSIENT) {
            log.warn("transient failure: {}", e.getMessage(), e);
        }
        return body(e.getKind(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handle(MethodArgumentNotValidException e) {
        var errors = e.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(f -> f.getField(),
                        f -> String.valueOf(f.getDefaultMessage()), (a, b) -> a));
        return body(ErrorKind.BAD_REQUEST, "validation failed", errors);
    }

    // 잘못된 UUID 경로 변수, 잘못된 JSON 본문
    @ExceptionHandler({ MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, Object>> handleMalformed(Exception e) {
        String message = (e instanceof MethodArgumentTypeMismatchException mm)
                ? "Invalid " + mm.getName()
                : "Malformed request body";
        return body(ErrorKind.BAD_REQUEST, message, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return body(ErrorKind.BAD_REQUEST, e.getMessage(), null);
    }

    // 인증 principal 해석 실패 (401)
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", e.getReason() == null ? "" : e.getReason());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(DataAccessException e) {
        log.error("storage failure", e);
        return body(ErrorKind.TRANSIENT, "Storage temporarily unavailable", null);
    }

    @ExceptionHandler({ org.springframework.security.access.AccessDeniedException.class })
    public ResponseEntity<Map<String, Object>> handleDenied(Exception e) {
        return body(ErrorKind.FORBIDDEN, "접근 권한이 없습니다.", null);
    }

    private static ResponseEntity<Map<String, Object>> body(ErrorKind kind, String message, Map<String, String> errors) {
        HttpStatus status = kind.status();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("kind", kind.name());
        body.put("message", message == null ? "" : message);
        if (errors != null) body.put("errors", errors);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
