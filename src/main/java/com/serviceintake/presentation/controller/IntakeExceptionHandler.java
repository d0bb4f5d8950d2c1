package com.serviceintake.presentation.controller;

import com.serviceintake.domain.exception.FlowFailureException;
import com.serviceintake.domain.exception.IdentityValidationException;
import com.serviceintake.domain.exception.ResolutionFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Traduce las excepciones de resolución a respuestas HTTP.
 * En todos los casos de error no se creó nada.
 */
@RestControllerAdvice
@Slf4j
public class IntakeExceptionHandler {

    @ExceptionHandler({ IdentityValidationException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, Object>> handleValidation(Exception ex) {
        log.warn("Solicitud inválida: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILURE", ex.getMessage(), null);
    }

    @ExceptionHandler(ResolutionFailureException.class)
    public ResponseEntity<Map<String, Object>> handleResolution(ResolutionFailureException ex) {
        log.warn("Fallo de resolución (reintentable): {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "RESOLUTION_FAILURE", ex.getMessage(), null);
    }

    @ExceptionHandler(FlowFailureException.class)
    public ResponseEntity<Map<String, Object>> handleFlowFailure(FlowFailureException ex) {
        log.error("Flujo revertido en el paso {}: {}", ex.getStep(), ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "FLOW_FAILURE", ex.getMessage(), ex.getStep().name());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleStoreFailure(DataAccessException ex) {
        log.error("Error del almacén: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_FAILURE", ex.getMessage(), null);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message, String step) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("error", code);
        response.put("message", message);
        if (step != null) {
            response.put("step", step);
        }
        return ResponseEntity.status(status).body(response);
    }
}
