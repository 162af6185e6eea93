package com.jreinhal.lectern.exception;

import com.jreinhal.lectern.constant.RagConstants;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern QUALIFIED_NAME = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, clientMessage(ex.getMessage()));
    }

    @ExceptionHandler(PartitionUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handlePartitionUnavailable(PartitionUnavailableException ex) {
        log.error("Partition unavailable: {}", ex.getMessage(), ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, RagConstants.SERVICE_UNAVAILABLE_MESSAGE);
    }

    @ExceptionHandler(EmbeddingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleEmbeddingFailure(EmbeddingFailureException ex) {
        log.error("Embedding service failed: {}", ex.getMessage(), ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, RagConstants.SERVICE_UNAVAILABLE_MESSAGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    /**
     * Messages that look like they carry class names, paths or traces are replaced.
     */
    static String clientMessage(String message) {
        if (message == null || message.isBlank() || message.length() > 200 || message.contains("/") || message.contains("\\")
                || message.contains("Exception") || QUALIFIED_NAME.matcher(message).find()) {
            return "Invalid request";
        }
        return message;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("timestamp", Instant.now().toString());
        String correlationId = MDC.get("correlationId");
        if (correlationId != null) {
            body.put("correlationId", correlationId);
        }
        return ResponseEntity.status(status).body(body);
    }
}
