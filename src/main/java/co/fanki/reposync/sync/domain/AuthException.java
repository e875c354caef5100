package co.fanki.reposync.sync.domain;

import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.OrchestrationException;

/**
 * The remote rejected the credential.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AuthException extends OrchestrationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message the error message
     * @param cause the underlying cause, may be null
     */
    public AuthException(final String message, final Throwable cause) {
        super(ErrorKind.AUTH, message, cause);
    }

}
