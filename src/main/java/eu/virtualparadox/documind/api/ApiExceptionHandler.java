package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.catalog.DocumentAccessDeniedException;
import eu.virtualparadox.documind.catalog.DocumentNotFoundException;
import eu.virtualparadox.documind.ingest.extractor.UnsupportedFormatException;
import eu.virtualparadox.documind.rag.embed.EmbeddingUnavailableException;
import eu.virtualparadox.documind.rag.index.DimensionMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders failures as {@code {"error": {"code": ..., "message": ...}}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedFormat(UnsupportedFormatException exception) {
        final HttpStatus status = exception.getReason() == UnsupportedFormatException.EReason.UNKNOWN_FORMAT
                ? HttpStatus.UNSUPPORTED_MEDIA_TYPE
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return error(status, exception.getReason().name(), exception.getMessage());
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(DocumentNotFoundException exception) {
        return error(HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND", exception.getMessage());
    }

    @ExceptionHandler(DocumentAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(DocumentAccessDeniedException exception) {
        return error(HttpStatus.FORBIDDEN, "ACCESS_DENIED", exception.getMessage());
    }

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleDimensionMismatch(DimensionMismatchException exception) {
        log.error("Embedding dimension does not match the index", exception);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "DIMENSION_MISMATCH", exception.getMessage());
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleEmbeddingUnavailable(EmbeddingUnavailableException exception) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "EMBEDDING_UNAVAILABLE", exception.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(MaxUploadSizeExceededException exception) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE", exception.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, ServletRequestBindingException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception exception) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", exception.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception exception) {
        log.error("Unexpected failure", exception);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected failure: " + exception.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message == null ? status.getReasonPhrase() : message);

        Map<String, Object> body = Map.of("error", error);
        return ResponseEntity.status(status).body(body);
    }
}
