package co.fanki.reposync.shared;

/**
 * Base exception for violations of the orchestrator's domain rules.
 *
 * <p>Every domain exception carries a stable, machine readable error
 * code. Codes are surfaced by the REST layer and recorded in workflow
 * reports, so they must never contain credential material.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Code used when no specific one is given. */
    public static final String GENERIC_CODE = "DOMAIN_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with the generic error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, GENERIC_CODE);
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Checks whether this exception carries the given code.
     *
     * @param code the code to compare with
     * @return true if the codes are equal
     */
    public boolean hasCode(final String code) {
        return errorCode.equals(code);
    }

}
