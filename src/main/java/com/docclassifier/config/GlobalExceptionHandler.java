package com.docclassifier.config;

import com.docclassifier.shared.exception.ClassificationException;
import com.docclassifier.shared.exception.ClassifierException;
import com.docclassifier.shared.exception.ExtractionFailedException;
import com.docclassifier.shared.exception.InfrastructureException;
import com.docclassifier.shared.exception.JobNotFoundException;
import com.docclassifier.shared.exception.UnknownIndustryException;
import com.docclassifier.shared.exception.UnsupportedFormatException;
import com.docclassifier.util.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Value("${app.upload.max-file-size-bytes:52428800}")
    private long maxFileSizeBytes;

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedFormat(UnsupportedFormatException ex) {
        return classificationError(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex);
    }

    @ExceptionHandler(ExtractionFailedException.class)
    public ResponseEntity<Map<String, Object>> handleExtractionFailed(ExtractionFailedException ex) {
        return classificationError(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(UnknownIndustryException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownIndustry(UnknownIndustryException ex) {
        return classificationError(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(ClassifierException.class)
    public ResponseEntity<Map<String, Object>> handleClassifierError(ClassifierException ex) {
        logger.error("Classifier error", ex);
        return classificationError(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<Map<String, Object>> handleInfrastructure(InfrastructureException ex) {
        logger.error("Infrastructure error", ex);
        return classificationError(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(JobNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NotFound", ex.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSizeException(MaxUploadSizeExceededException ex) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(body("FileSizeExceeded",
                "File size exceeds maximum allowed size (" + maxFileSizeBytes / (1024 * 1024) + " MB)"));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleMissingPart(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("ValidationError", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("IllegalArgument", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(ex.getClass().getSimpleName(),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred"));
    }

    private ResponseEntity<Map<String, Object>> classificationError(HttpStatus status, ClassificationException ex) {
        Map<String, Object> response = body(ex.getErrorCode().name(), ex.getMessage());
        response.put("code", ex.getErrorCode());
        return ResponseEntity.status(status).body(response);
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", Instant.now().toString());
        response.put("traceId", MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
        return response;
    }
}
