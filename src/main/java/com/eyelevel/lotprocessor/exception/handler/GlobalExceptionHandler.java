package com.eyelevel.lotprocessor.exception.handler;

import com.eyelevel.lotprocessor.dto.common.ApiResponse;
import com.eyelevel.lotprocessor.exception.InferenceGatewayException;
import com.eyelevel.lotprocessor.exception.InvalidSignatureException;
import com.eyelevel.lotprocessor.exception.JobNotFoundException;
import com.eyelevel.lotprocessor.exception.JobStateConflictException;
import com.eyelevel.lotprocessor.exception.LotProcessingException;
import com.eyelevel.lotprocessor.exception.apiclient.*;
import com.eyelevel.lotprocessor.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It intercepts exceptions thrown from controllers and converts them into a
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles invalid requests and business-rule violations. (400 Bad Request)
     */
    @ExceptionHandler({LotProcessingException.class, JsonParsingException.class, BadRequestException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("Malformed request body.",
                                                         "The request body is missing or could not be parsed.");
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.", ex.getParameterName(),
                                            ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Required parameter is missing.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                          .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                          .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles violations on request parameters and on programmatically validated request bodies. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                          .map(violation -> String.format("'%s': %s", violation.getPropertyPath(),
                                                          violation.getMessage()))
                          .sorted()
                          .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid input provided.", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                                            ex.getName(), ex.getRequiredType() != null
                                                          ? ex.getRequiredType().getSimpleName()
                                                          : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid parameter type provided.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles requests whose HMAC signature does not match. (403 Forbidden)
     */
    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ApiResponse<Object>> handleInvalidSignature(InvalidSignatureException ex) {
        log.warn("Invalid Signature Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.FORBIDDEN);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleJobNotFound(JobNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNullElse(ex.getSupportedMethods(), new String[0]));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                            ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Method not allowed.", errorMessage),
                                    HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles operations the resource's current state does not allow. (409 Conflict)
     */
    @ExceptionHandler(JobStateConflictException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(JobStateConflictException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.CONFLICT);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles failures of the inference provider that surface synchronously, e.g. during submission.
     * The remote status is reported as a gateway error.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Object>> handleApiException(ApiException ex) {
        log.error("Downstream API Exception (status {}): {}", ex.getStatusCode(), ex.getMessage());
        HttpStatus status = ex instanceof GatewayTimeoutException ? HttpStatus.GATEWAY_TIMEOUT
                            : ex instanceof ServiceUnavailableException ? HttpStatus.SERVICE_UNAVAILABLE
                            : HttpStatus.BAD_GATEWAY;
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), status);
    }

    @ExceptionHandler(InferenceGatewayException.class)
    public ResponseEntity<ApiResponse<Object>> handleInferenceGatewayException(InferenceGatewayException ex) {
        log.error("Inference gateway failure: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_GATEWAY);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        ApiResponse<Object> response = ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
