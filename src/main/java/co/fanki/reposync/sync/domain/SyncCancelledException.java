package co.fanki.reposync.sync.domain;

import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.OrchestrationException;

/**
 * The sync was aborted by a shutdown signal; the workspace is left as it was.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SyncCancelledException extends OrchestrationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message the error message
     * @param cause the underlying cause, may be null
     */
    public SyncCancelledException(final String message, final Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }

}
