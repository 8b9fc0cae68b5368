package com.vcc.admission.web;

import com.vcc.admission.config.AdmissionConfigurationException;
import com.vcc.admission.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Renders admin API failures as {@code {error, message}} JSON.
 */
@RestControllerAdvice(assignableTypes = AdminController.class)
public class AdminExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(AdminExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(new ErrorResponse("validation_failed", message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", e.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", e.getMessage()));
    }

    @ExceptionHandler(AdmissionConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(AdmissionConfigurationException e) {
        log.warn("Rejected admin request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("invalid_configuration", e.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        String error = status != null ? status.name().toLowerCase() : "error";
        return ResponseEntity.status(e.getStatusCode()).body(new ErrorResponse(error, e.getReason()));
    }
}
