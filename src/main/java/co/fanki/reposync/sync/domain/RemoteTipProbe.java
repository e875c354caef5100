package co.fanki.reposync.sync.domain;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.repository.domain.RepositoryRef;

import java.util.Optional;

/**
 * Reads the commit a remote's default branch points at, without
 * fetching objects.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface RemoteTipProbe {

    /**
     * Looks up the remote tip.
     *
     * @param repo the repository to probe
     * @param credential the credential to authenticate with
     * @return the commit id, or empty if the remote has no commits
     * @throws co.fanki.reposync.shared.OrchestrationException classified
     *         like sync failures when the remote cannot be reached
     */
    Optional<String> remoteTip(RepositoryRef repo, CredentialHandle credential);

}
