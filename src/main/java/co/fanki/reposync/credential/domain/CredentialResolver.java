package co.fanki.reposync.credential.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the first usable credential for a repository.
 *
 * <p>Candidates are tried in the caller's order. Missing and expired
 * entries are skipped. The resolver only reads from the secret store;
 * it never fetches, refreshes or mutates secrets.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CredentialResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            CredentialResolver.class);

    private final SecretStore secretStore;
    private final Clock clock;

    /**
     * Creates a new CredentialResolver.
     *
     * @param theSecretStore the store to read from
     * @param theClock the clock used for expiry checks
     */
    public CredentialResolver(final SecretStore theSecretStore,
            final Clock theClock) {
        this.secretStore = Preconditions.requireNonNull(theSecretStore,
                "Secret store is required");
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
    }

    /**
     * Resolves the first usable credential.
     *
     * @param repo the repository to authenticate against
     * @param candidates the methods to try, in preference order
     * @return the credential
     * @throws NoUsableCredentialException if every candidate is missing
     *         or expired
     */
    public CredentialHandle resolve(final RepositoryRef repo,
            final List<CredentialMethod> candidates) {
        return firstUsable(repo, candidates, Set.of())
                .orElseThrow(() -> new NoUsableCredentialException(
                        repo, candidates));
    }

    /**
     * Resolves the next-best credential, skipping methods already used.
     *
     * @param repo the repository to authenticate against
     * @param candidates the methods to try, in preference order
     * @param alreadyTried methods that must not be returned again
     * @return the alternative, or empty if there is none
     */
    public Optional<CredentialHandle> resolveExcluding(
            final RepositoryRef repo,
            final List<CredentialMethod> candidates,
            final Collection<CredentialMethod> alreadyTried) {
        return firstUsable(repo, candidates, alreadyTried);
    }

    private Optional<CredentialHandle> firstUsable(final RepositoryRef repo,
            final List<CredentialMethod> candidates,
            final Collection<CredentialMethod> excluded) {
        Preconditions.requireNonNull(repo, "Repository is required");
        Preconditions.requireNonNull(candidates, "Candidates are required");

        for (final CredentialMethod method : candidates) {
            if (excluded.contains(method)) {
                continue;
            }
            final Optional<CredentialHandle> handle =
                    secretStore.get(method, repo);
            if (handle.isEmpty()) {
                LOG.debug("No {} credential stored for {}", method, repo);
                continue;
            }
            if (handle.get().isExpiredAt(clock.instant())) {
                LOG.info("Skipping expired {} credential for {} (expired {})",
                        method, repo, handle.get().expiresAt());
                continue;
            }
            LOG.debug("Resolved {} credential for {}", method, repo);
            return handle;
        }
        return Optional.empty();
    }

}
