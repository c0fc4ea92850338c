package com.herzen.ink.api;

import com.herzen.ink.parser.InkParseException;
import com.herzen.ink.runtime.StoryRuntimeException;
import com.herzen.ink.service.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StoryRuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleRuntime(StoryRuntimeException e) {
        log.warn("Playback rejected [{}]: {}", e.getCode(), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getCode().name(), e.getMessage());
    }

    @ExceptionHandler(InkParseException.class)
    public ResponseEntity<Map<String, Object>> handleParse(InkParseException e) {
        log.warn("Story source rejected: {} error(s)", e.getErrors().size());
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.BAD_REQUEST, "PARSE_ERROR", e.getMessage());
        response.getBody().put("errors", e.getErrors());
        return response;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        return ResponseEntity.status(status).body(error);
    }
}
