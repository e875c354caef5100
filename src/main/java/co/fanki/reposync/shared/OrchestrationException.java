package co.fanki.reposync.shared;

/**
 * Failure raised while driving a repository through a sync pass.
 *
 * <p>The error code is the name of the {@link ErrorKind}, so reports and
 * REST responses share one vocabulary.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class OrchestrationException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    /**
     * Creates a new orchestration exception.
     *
     * @param theKind the failure classification, not null
     * @param message the error message
     */
    public OrchestrationException(final ErrorKind theKind,
            final String message) {
        super(message, theKind.name());
        this.kind = theKind;
    }

    /**
     * Creates a new orchestration exception with a cause.
     *
     * @param theKind the failure classification, not null
     * @param message the error message
     * @param cause the underlying cause
     */
    public OrchestrationException(final ErrorKind theKind,
            final String message, final Throwable cause) {
        super(message, theKind.name(), cause);
        this.kind = theKind;
    }

    /**
     * Returns the failure classification.
     *
     * @return the kind, never null
     */
    public ErrorKind kind() {
        return kind;
    }

}
