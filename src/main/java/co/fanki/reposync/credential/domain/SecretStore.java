package co.fanki.reposync.credential.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;

import java.util.Optional;

/**
 * Read access to stored credentials.
 *
 * <p>Lookups may block on a remote store. Implementations must make a
 * single record read atomic; no other locking is expected from them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface SecretStore {

    /**
     * Looks up the credential stored for a method and repository.
     *
     * @param method the method tag
     * @param repo the repository the credential is for
     * @return the handle, or empty when none is stored
     */
    Optional<CredentialHandle> get(CredentialMethod method, RepositoryRef repo);

}
