package com.tablerewriter.exception;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleMaxSizeException(MaxUploadSizeExceededException exc) {
        log.error("File size exceeds maximum limit", exc);
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "File size exceeds maximum limit of 50MB");
    }

    @ExceptionHandler(JSQLParserException.class)
    public ResponseEntity<Map<String, String>> handleParseException(JSQLParserException exc) {
        log.error("Failed to parse SQL: {}", exc.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Failed to parse SQL: " + exc.getMessage());
    }

    // Also covers UnsupportedStatementException and InvalidReplacementException
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgumentException(IllegalArgumentException exc) {
        log.error("Invalid argument: {}", exc.getMessage());
        return error(HttpStatus.BAD_REQUEST, exc.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception exc) {
        log.error("Unexpected error occurred", exc);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again.");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.status(status).body(error);
    }
}
