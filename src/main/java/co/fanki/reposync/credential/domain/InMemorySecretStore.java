package co.fanki.reposync.credential.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.Preconditions;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Secret store held in process memory.
 *
 * <p>Credentials can be registered for one repository or as a default
 * for every repository; a repository specific entry wins. Anonymous
 * access is always available.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemorySecretStore implements SecretStore {

    private static final String ANY_REPOSITORY = "*";

    private final ConcurrentMap<String, CredentialHandle> handles =
            new ConcurrentHashMap<>();

    /**
     * Registers a credential for a single repository.
     *
     * @param repo the repository
     * @param handle the credential
     */
    public void put(final RepositoryRef repo, final CredentialHandle handle) {
        Preconditions.requireNonNull(repo, "Repository is required");
        Preconditions.requireNonNull(handle, "Credential is required");
        handles.put(key(handle.method(), repo.identifier()), handle);
    }

    /**
     * Registers a credential used for any repository without its own.
     *
     * @param handle the credential
     */
    public void putDefault(final CredentialHandle handle) {
        Preconditions.requireNonNull(handle, "Credential is required");
        handles.put(key(handle.method(), ANY_REPOSITORY), handle);
    }

    /**
     * Removes every credential of a method registered for a repository.
     *
     * @param method the method tag
     * @param repo the repository
     */
    public void remove(final CredentialMethod method, final RepositoryRef repo) {
        handles.remove(key(method, repo.identifier()));
    }

    @Override
    public Optional<CredentialHandle> get(final CredentialMethod method,
            final RepositoryRef repo) {
        if (method == CredentialMethod.ANONYMOUS) {
            return Optional.of(CredentialHandle.anonymous());
        }
        final CredentialHandle specific = handles.get(
                key(method, repo.identifier()));
        if (specific != null) {
            return Optional.of(specific);
        }
        return Optional.ofNullable(handles.get(key(method, ANY_REPOSITORY)));
    }

    private static String key(final CredentialMethod method,
            final String repository) {
        return method.name() + "@" + repository;
    }

}
