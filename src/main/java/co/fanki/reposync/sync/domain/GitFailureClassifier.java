package co.fanki.reposync.sync.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.OrchestrationException;
import org.eclipse.jgit.errors.NoRemoteRepositoryException;

import java.util.List;
import java.util.Locale;

/**
 * Maps JGit transport failures onto the orchestrator's error taxonomy.
 *
 * <p>JGit reports authentication problems as plain transport exceptions,
 * so the classification looks at the cause chain and its messages. A
 * missing remote repository counts as an authentication failure: hosts
 * answer "not found" for private repositories the credential cannot
 * see.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class GitFailureClassifier {

    private static final List<String> AUTH_MARKERS = List.of(
            "not authorized",
            "not permitted",
            "authentication is required",
            "authentication not supported",
            "auth fail",
            "no more authentication methods",
            "could not authenticate",
            "invalid username or password");

    private GitFailureClassifier() {
    }

    /**
     * Classifies a failure raised while talking to the remote.
     *
     * @param repo the repository being synced
     * @param failure the JGit failure
     * @param cancellation the shutdown signal
     * @return the classified exception, ready to be thrown
     */
    static OrchestrationException classify(final RepositoryRef repo,
            final Exception failure, final CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return new SyncCancelledException(
                    "Sync of " + repo + " was cancelled", failure);
        }
        if (isAuthFailure(failure)) {
            return new AuthException(
                    "Remote rejected credential for " + repo, failure);
        }
        return new NetworkException("Transport failure for " + repo + ": "
                + failure.getMessage(), failure);
    }

    private static boolean isAuthFailure(final Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof NoRemoteRepositoryException) {
                return true;
            }
            final String message = current.getMessage();
            if (message != null) {
                final String lower = message.toLowerCase(Locale.ROOT);
                for (final String marker : AUTH_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

}
