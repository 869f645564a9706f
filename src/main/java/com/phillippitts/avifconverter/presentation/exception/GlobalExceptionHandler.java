package com.phillippitts.avifconverter.presentation.exception;

import com.phillippitts.avifconverter.domain.ConversionFailure;
import com.phillippitts.avifconverter.domain.ErrorKind;
import com.phillippitts.avifconverter.exception.ArtifactIOException;
import com.phillippitts.avifconverter.exception.ConversionFailedException;
import com.phillippitts.avifconverter.exception.ConverterBusyException;
import com.phillippitts.avifconverter.exception.UnsupportedFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Maps classified conversion failures to status codes: INPUT_ERROR 400, ENVIRONMENT_ERROR 503,
 * STAGE_FAILURE and IO_ERROR 500. Tool stderr is logged but never returned to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - format not jpeg/heic (HTTP 400).
     */
    @ExceptionHandler(UnsupportedFormatException.class)
    ResponseEntity<ApiError> handleUnsupportedFormat(UnsupportedFormatException ex) {
        LOG.warn("Unsupported upload format: {}", ex.getDeclaredFormat());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INPUT_ERROR.name(),
                "Unsupported image format", "Only JPEG and HEIC images are accepted");
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleMissingImage(Exception ex) {
        LOG.warn("Upload without image part: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INPUT_ERROR.name(),
                "No image uploaded", "Send the image as multipart field 'image'");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, ErrorKind.INPUT_ERROR.name(),
                "Image too large", "Maximum upload size exceeded");
    }

    /**
     * Classified conversion failure; status follows the error kind.
     */
    @ExceptionHandler(ConversionFailedException.class)
    ResponseEntity<ApiError> handleConversionFailed(ConversionFailedException ex) {
        ConversionFailure failure = ex.getFailure();
        HttpStatus status = statusFor(failure.kind());
        String details = failure.stage()
                .map(stage -> "Stage '" + stage + "' failed"
                        + (failure.exitCode() != null ? " with exit code " + failure.exitCode() : ""))
                .orElse(failure.message());
        return respond(status, failure.kind().name(), "Image conversion failed", details);
    }

    /**
     * Transient overload - retry possible (HTTP 503).
     */
    @ExceptionHandler(ConverterBusyException.class)
    ResponseEntity<ApiError> handleBusy(ConverterBusyException ex) {
        LOG.warn("Converter busy: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CONVERTER_BUSY",
                "Conversion service temporarily overloaded", "Please retry in a few seconds");
    }

    @ExceptionHandler(ArtifactIOException.class)
    ResponseEntity<ApiError> handleArtifactIo(ArtifactIOException ex) {
        LOG.error("Artifact I/O failed: role={}", ex.getRole(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.IO_ERROR.name(),
                "Image conversion failed", "Could not read or write image data");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case INPUT_ERROR -> HttpStatus.BAD_REQUEST;
            case ENVIRONMENT_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case STAGE_FAILURE, IO_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
