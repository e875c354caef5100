package co.fanki.reposync.sync.domain;

import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.OrchestrationException;

/**
 * The local checkout cannot be trusted; recovered with a forced re-clone.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CorruptWorkspaceException extends OrchestrationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message the error message
     * @param cause the underlying cause, may be null
     */
    public CorruptWorkspaceException(final String message, final Throwable cause) {
        super(ErrorKind.CORRUPT_WORKSPACE, message, cause);
    }

}
