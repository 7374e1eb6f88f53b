package com.tripmate.routeplanner.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps framework and unexpected errors to the API's JSON error envelope. Internal details are
 * logged, never returned.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String UNEXPECTED_ERROR = "Unexpected error.";

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> onUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(
                "Bad Request", RouteRequestValidator.NOT_AN_OBJECT, List.of()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> onNotFound(NoResourceFoundException e, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(
                "Not Found", noRouteMessage(request), null));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> onMethodNotSupported(HttpRequestMethodNotSupportedException e,
                                                                    HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(errorBody(
                "Method Not Allowed", noRouteMessage(request), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> onAny(Exception e) {
        if (e instanceof ErrorResponse) {
            // remaining Spring MVC client errors (unsupported media type, missing parameter, ...)
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            HttpStatus resolved = HttpStatus.resolve(status.value());
            if (status.is4xxClientError()) {
                log.debug("Client error {}: {}", status.value(), e.getMessage());
                return ResponseEntity.status(status).body(errorBody(
                        resolved != null ? resolved.getReasonPhrase() : "Bad Request", "Invalid request.", null));
            }
        }
        log.error("❌ Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody(
                "Internal Server Error", UNEXPECTED_ERROR, null));
    }

    static Map<String, Object> errorBody(String error, String message, List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }

    private static String noRouteMessage(HttpServletRequest request) {
        return "No route matched " + request.getMethod() + " " + request.getRequestURI();
    }
}
