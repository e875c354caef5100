package co.fanki.reposync.credential.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.OrchestrationException;

import java.util.List;

/**
 * Raised when none of the candidate methods yields a usable credential.
 *
 * <p>This is a configuration problem, not a transient fault: the job
 * fails the pass without retrying.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NoUsableCredentialException extends OrchestrationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param repo the repository that could not be authenticated
     * @param tried the methods that were looked up
     */
    public NoUsableCredentialException(final RepositoryRef repo,
            final List<CredentialMethod> tried) {
        super(ErrorKind.NO_USABLE_CREDENTIAL,
                "No usable credential for " + repo + " (tried " + tried + ")");
    }

}
