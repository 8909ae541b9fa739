package com.tabledesigner.web;

import com.tabledesigner.api.ErrorResponse;
import com.tabledesigner.error.DesignPersistenceFailedException;
import com.tabledesigner.error.DesignerException;
import com.tabledesigner.store.DesignStoreException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps every failure to an {@link ErrorResponse} carrying the error kind and the request trace id.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DesignerException.class)
    public ResponseEntity<ErrorResponse> handleDesignerException(DesignerException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case INVALID_DESIGN, INVALID_FIELD, SCHEMA_OPERATION_FAILED -> HttpStatus.BAD_REQUEST;
            case TABLE_NOT_FOUND, DESIGN_NOT_FOUND, FIELD_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_FIELD -> HttpStatus.CONFLICT;
            case DESIGN_PERSISTENCE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (ex instanceof DesignPersistenceFailedException inconsistent) {
            log.error("Live schema and design store disagree for table {}", inconsistent.getTableName());
        } else {
            log.info("Request rejected: {} {}", ex.getKind(), ex.getMessage());
        }

        ErrorResponse error = ErrorResponse.builder()
                .code(ex.getKind().name())
                .message(ex.getMessage())
                .details(ex.getCause() != null ? ex.getCause().getMessage() : null)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Input validation failed")
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("MALFORMED_REQUEST")
                .message("Request body is not valid JSON for this endpoint")
                .details(ex.getMostSpecificCause().getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(DesignStoreException.class)
    public ResponseEntity<ErrorResponse> handleDesignStoreException(DesignStoreException ex) {
        log.error("Design store error", ex);
        ErrorResponse error = ErrorResponse.builder()
                .code("DESIGN_STORE_ERROR")
                .message(ex.getMessage())
                .details(ex.getCause() != null ? ex.getCause().getMessage() : null)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("NOT_FOUND")
                .message("Not found")
                .details(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
