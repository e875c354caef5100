package co.fanki.reposync.config;

import co.fanki.reposync.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain failures raised by the REST layer to HTTP responses.
 *
 * <p>Error codes ending in {@code _NOT_FOUND} answer 404; every other
 * domain or validation failure answers 400.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(
            ApiExceptionHandler.class);

    /** Code returned for rejected arguments. */
    static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    /**
     * Handles domain exceptions.
     *
     * @param e the exception
     * @return the error response
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(final DomainException e) {
        final HttpStatus status = e.getErrorCode().endsWith("_NOT_FOUND")
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        LOG.debug("Request failed with {}: {}", e.getErrorCode(),
                e.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    /**
     * Handles invalid arguments, such as malformed repository URLs.
     *
     * @param e the exception
     * @return the error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            final IllegalArgumentException e) {
        LOG.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(INVALID_ARGUMENT, e.getMessage()));
    }

    /**
     * Error body.
     *
     * @param code the machine readable error code
     * @param message the human readable message
     */
    public record ErrorResponse(
            String code,
            String message
    ) {}

}
