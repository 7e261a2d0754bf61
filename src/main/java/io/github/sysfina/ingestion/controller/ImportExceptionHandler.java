package io.github.sysfina.ingestion.controller;

import io.github.sysfina.ingestion.controller.dto.ImportResponse;
import io.github.sysfina.ingestion.domain.exception.ImportAlreadyRunningException;
import io.github.sysfina.ingestion.domain.exception.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure to the {@code {success:false, message}} envelope.
 */
@Slf4j
@RestControllerAdvice
public class ImportExceptionHandler {

    static final String UNEXPECTED_MESSAGE = "Erro inesperado na importação.";

    @ExceptionHandler(ImportAlreadyRunningException.class)
    public ResponseEntity<ImportResponse> handleAlreadyRunning(ImportAlreadyRunningException ex) {
        return build(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ImportResponse> handleIngestion(IngestionException ex) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ImportResponse> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ImportResponse> handleNotFound(NoResourceFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ImportResponse> handleGeneric(Exception ex) {
        log.error("Erro não tratado na requisição", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : UNEXPECTED_MESSAGE;
        return build(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    private ResponseEntity<ImportResponse> build(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ImportResponse.failure(message));
    }
}
