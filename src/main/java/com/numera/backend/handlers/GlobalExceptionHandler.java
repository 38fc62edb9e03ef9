package com.numera.backend.handlers;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import com.numera.backend.dto.ApiResponse;
import com.numera.backend.exceptions.AuthorizationException;
import com.numera.backend.exceptions.ExtractionFailureException;
import com.numera.backend.exceptions.IngestionException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.exceptions.UpstreamServiceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps the ingestion failure taxonomy to HTTP. The reason code goes back to the client;
 * the diagnostic excerpt is only logged.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private <T> ResponseEntity<ApiResponse<T>> buildResponse(
            HttpStatus status,
            String message,
            List<String> errors
    ) {
        ApiResponse<T> body = ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .timestamp(LocalDateTime.now())
                .errors(errors)
                .build();

        return ResponseEntity.status(status).body(body);
    }

    private <T> ResponseEntity<ApiResponse<T>> fromIngestion(HttpStatus status, IngestionException ex) {
        if (ex.getDiagnosticExcerpt() != null) {
            log.warn("[Ingestion] {} reason={} excerpt='{}'", status.value(), ex.getReason(), ex.getDiagnosticExcerpt());
        } else {
            log.warn("[Ingestion] {} reason={}", status.value(), ex.getReason());
        }
        return buildResponse(status, ex.getMessage(), List.of(ex.getReason()));
    }

    // 400 - refused before parsing
    @ExceptionHandler(InputRejectedException.class)
    public ResponseEntity<ApiResponse<Void>> handleInputRejected(InputRejectedException ex) {
        return fromIngestion(HttpStatus.BAD_REQUEST, ex);
    }

    // 422 - nothing usable came out of the source (covers ValidationFailureException)
    @ExceptionHandler(ExtractionFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleExtractionFailure(ExtractionFailureException ex) {
        return fromIngestion(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    // 403 - resource of another user
    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuthorization(AuthorizationException ex) {
        return fromIngestion(HttpStatus.FORBIDDEN, ex);
    }

    // 502 - aggregator or processor failed
    @ExceptionHandler(UpstreamServiceException.class)
    public ResponseEntity<ApiResponse<Void>> handleUpstream(UpstreamServiceException ex) {
        return fromIngestion(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.toList());

        return buildResponse(HttpStatus.BAD_REQUEST, "Validation error", errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingHeader(MissingRequestHeaderException ex) {
        return buildResponse(HttpStatus.UNAUTHORIZED, "Caller identity missing", List.of(ex.getHeaderName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid value for " + ex.getName(), List.of(ex.getName()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "The uploaded file is too large", List.of("upload-too-large"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        String msg = ex.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = "Invalid request";
        }
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(msg));
    }

    // 500 - unexpected
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }
}
