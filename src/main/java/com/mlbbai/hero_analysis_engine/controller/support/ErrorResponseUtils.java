package com.mlbbai.hero_analysis_engine.controller.support;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helper for producing consistent {@code {error, message?}} payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String message) {
        return errorBody(message, null);
    }

    public static Map<String, String> errorBody(String message, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    public static ResponseEntity<Object> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(errorBody(message));
    }

    public static ResponseEntity<Object> error(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(errorBody(message, detail));
    }
}
