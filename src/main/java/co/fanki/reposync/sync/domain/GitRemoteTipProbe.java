package co.fanki.reposync.sync.domain;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.Preconditions;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.LsRemoteCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link RemoteTipProbe} backed by {@code git ls-remote}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GitRemoteTipProbe implements RemoteTipProbe {

    private static final CancellationToken NEVER = new CancellationToken();

    private final GitAuthentication authentication;
    private final Function<RepositoryRef, String> remoteUrls;
    private final Duration timeout;

    /**
     * Creates a new GitRemoteTipProbe.
     *
     * @param theAuthentication maps credentials to transport settings
     * @param theRemoteUrls resolves the URL of a repository
     * @param theTimeout the transport timeout
     */
    public GitRemoteTipProbe(final GitAuthentication theAuthentication,
            final Function<RepositoryRef, String> theRemoteUrls,
            final Duration theTimeout) {
        this.authentication = Preconditions.requireNonNull(theAuthentication,
                "Git authentication is required");
        this.remoteUrls = Preconditions.requireNonNull(theRemoteUrls,
                "Remote URL resolver is required");
        this.timeout = Preconditions.requirePositive(theTimeout,
                "Probe timeout must be positive");
    }

    @Override
    public Optional<String> remoteTip(final RepositoryRef repo,
            final CredentialHandle credential) {
        final String url = remoteUrls.apply(repo.withProtocol(
                credential.method().transportFor(repo.protocol())));
        final LsRemoteCommand lsRemote = Git.lsRemoteRepository()
                .setRemote(url)
                .setTimeout((int) Math.max(1, timeout.toSeconds()));

        try (GitAuthentication.Session session = authentication.open(credential)) {
            session.configure(lsRemote);
            final Map<String, Ref> refs = lsRemote.callAsMap();
            final Ref head = refs.get(Constants.HEAD);
            if (head == null) {
                return Optional.empty();
            }
            final ObjectId id = head.getObjectId();
            return id == null ? Optional.empty() : Optional.of(id.getName());
        } catch (final GitAPIException | JGitInternalException e) {
            throw GitFailureClassifier.classify(repo, e, NEVER);
        }
    }

}
