package com.itembank.tos.api;

import com.itembank.tos.service.QuestionNotFoundException;
import com.itembank.tos.sufficiency.InvalidRequirementMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRequirementMatrixException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidMatrix(InvalidRequirementMatrixException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_requirement_matrix", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidInput(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_input", ex.getMessage());
    }

    @ExceptionHandler(QuestionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(QuestionNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException ex) {
        log.error("Unhandled error while serving request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Request failed");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
