package co.fanki.reposync.sync.domain;

import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.OrchestrationException;

/**
 * Transient transport failure; retried with backoff.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NetworkException extends OrchestrationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message the error message
     * @param cause the underlying cause, may be null
     */
    public NetworkException(final String message, final Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
    }

}
