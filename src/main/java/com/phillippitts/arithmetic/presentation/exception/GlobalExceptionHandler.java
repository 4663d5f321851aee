package com.phillippitts.arithmetic.presentation.exception;

import com.phillippitts.arithmetic.config.properties.ArithmeticServiceProperties;
import com.phillippitts.arithmetic.domain.ArithmeticOperation;
import com.phillippitts.arithmetic.exception.InvalidOperationRequestException;
import com.phillippitts.arithmetic.exception.OperandConstraintViolationException;
import com.phillippitts.arithmetic.presentation.dto.ApiError;
import com.phillippitts.arithmetic.service.metrics.OperationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import static com.phillippitts.arithmetic.util.LogSanitizer.preview;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts exceptions to {@code {"error": ...}} bodies with the appropriate status code.
 * Logs details server-side while never exposing exception messages for malformed input
 * or unexpected failures.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    private final ArithmeticOperation operation;
    private final OperationMetrics metrics;

    GlobalExceptionHandler(ArithmeticServiceProperties properties, OperationMetrics metrics) {
        this.operation = properties.getOperation();
        this.metrics = metrics;
    }

    /**
     * Client error - body missing, not an object, or operands not finite numbers (HTTP 400).
     */
    @ExceptionHandler(InvalidOperationRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidOperationRequestException ex) {
        LOG.warn("Invalid {} request: {}", operation, preview(ex.getReason()));
        return invalidRequest();
    }

    /**
     * Client error - JSON could not be parsed (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable {} request body: {}", operation, preview(ex.getMostSpecificCause().getMessage()));
        return invalidRequest();
    }

    /**
     * Client error - body sent with a non-JSON content type (HTTP 400).
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        LOG.warn("Unsupported content type for {} request: {}", operation, ex.getContentType());
        return invalidRequest();
    }

    /**
     * Domain error - operands rejected by the operation's constraint (HTTP 400).
     * The constraint message is client-facing by contract.
     */
    @ExceptionHandler(OperandConstraintViolationException.class)
    ResponseEntity<ApiError> handleConstraintViolation(OperandConstraintViolationException ex) {
        LOG.warn("{} request rejected: {}", ex.getOperation(), ex.getMessage());
        metrics.incrementRejected(ex.getOperation(), OperationMetrics.REASON_CONSTRAINT_VIOLATION);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getMessage()));
    }

    /**
     * Framework errors (unknown path, unsupported method) keep their status; anything else
     * is unexpected (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            LOG.debug("Request failed with status {}: {}", status.value(), ex.getMessage());
            HttpStatus known = HttpStatus.resolve(status.value());
            return ResponseEntity
                .status(status)
                .body(new ApiError(known != null ? known.getReasonPhrase() : "Request failed"));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(ApiError.INTERNAL_ERROR));
    }

    private ResponseEntity<ApiError> invalidRequest() {
        metrics.incrementRejected(operation, OperationMetrics.REASON_INVALID_REQUEST);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiError.invalidRequest());
    }
}
