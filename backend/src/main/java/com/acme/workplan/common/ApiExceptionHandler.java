package com.acme.workplan.common;

import com.acme.workplan.hierarchy.InvalidHierarchyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final String MALFORMED_BODY = "Malformed request body: expected a JSON object with only the documented fields";
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> validation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream().findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("Request validation failed");
        return ResponseEntity.badRequest().body(new ApiError(ErrorKind.INVALID_ARGUMENT.name(), message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(new ApiError(ErrorKind.INVALID_ARGUMENT.name(), MALFORMED_BODY));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> badParameter(Exception ex) {
        return ResponseEntity.badRequest().body(new ApiError(ErrorKind.INVALID_ARGUMENT.name(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidHierarchyException.class)
    ResponseEntity<ApiError> hierarchy(InvalidHierarchyException ex) {
        log.warn("Rejected structural write ({}): {}", ex.getViolation().code(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiError(ex.getKind().name(), ex.getMessage(), ex.getViolation().code()));
    }

    @ExceptionHandler(WorkPlanException.class)
    ResponseEntity<ApiError> workPlan(WorkPlanException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_HIERARCHY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        if (ex.getKind() == ErrorKind.STORAGE_FAILURE) {
            log.error("Storage failure: {}", ex.getMessage(), ex);
        }
        return ResponseEntity.status(status).body(new ApiError(ex.getKind().name(), ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    ResponseEntity<ApiError> storage(DataAccessException ex) {
        log.error("Backing store rejected the operation", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError(ErrorKind.STORAGE_FAILURE.name(), "Backing store failure: " + ex.getMostSpecificCause().getMessage()));
    }
}
