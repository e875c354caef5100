package co.fanki.reposync.config;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.credential.domain.CredentialScope;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * List valued orchestrator settings: statically configured repositories
 * and the secrets backing the configuration secret store.
 *
 * <p>Scalar settings are injected with {@code @Value} where they are
 * used.</p>
 *
 * <pre>
 * orchestrator:
 *   repositories:
 *     - url: https://github.com/acme/widgets.git
 *       access-hint: ANONYMOUS
 *   secrets:
 *     - method: PAT
 *       value: ${GITHUB_TOKEN}
 *     - method: DEPLOY_KEY
 *       repository: acme/widgets
 *       value: ${WIDGETS_DEPLOY_KEY}
 *       expires-at: 2030-01-01T00:00:00Z
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    /**
     * Repositories enqueued at startup.
     */
    private List<RepositoryEntry> repositories = new ArrayList<>();

    /**
     * Credentials, global or bound to one repository.
     */
    private List<SecretEntry> secrets = new ArrayList<>();

    public List<RepositoryEntry> getRepositories() {
        return repositories;
    }

    public void setRepositories(final List<RepositoryEntry> theRepositories) {
        this.repositories = theRepositories;
    }

    public List<SecretEntry> getSecrets() {
        return secrets;
    }

    public void setSecrets(final List<SecretEntry> theSecrets) {
        this.secrets = theSecrets;
    }

    /**
     * A statically configured repository.
     */
    public static class RepositoryEntry {

        /**
         * Clone URL, https or ssh.
         */
        private String url;

        /**
         * Credential method to try first.
         */
        private CredentialMethod accessHint;

        public String getUrl() {
            return url;
        }

        public void setUrl(final String theUrl) {
            this.url = theUrl;
        }

        public CredentialMethod getAccessHint() {
            return accessHint;
        }

        public void setAccessHint(final CredentialMethod theAccessHint) {
            this.accessHint = theAccessHint;
        }
    }

    /**
     * A configured credential.
     */
    public static class SecretEntry {

        /**
         * The credential method the secret belongs to.
         */
        private CredentialMethod method;

        /**
         * Repository the secret is bound to, as {@code owner/name},
         * {@code host/owner/name} or a clone URL. Unset for a secret
         * usable with every repository.
         */
        private String repository;

        /**
         * The token or PEM encoded private key.
         */
        private String value;

        /**
         * When the secret stops working. Unset if it does not expire.
         */
        private Instant expiresAt;

        /**
         * What the secret allows.
         */
        private CredentialScope scope = CredentialScope.READ_ONLY;

        public CredentialMethod getMethod() {
            return method;
        }

        public void setMethod(final CredentialMethod theMethod) {
            this.method = theMethod;
        }

        public String getRepository() {
            return repository;
        }

        public void setRepository(final String theRepository) {
            this.repository = theRepository;
        }

        public String getValue() {
            return value;
        }

        public void setValue(final String theValue) {
            this.value = theValue;
        }

        public Instant getExpiresAt() {
            return expiresAt;
        }

        public void setExpiresAt(final Instant theExpiresAt) {
            this.expiresAt = theExpiresAt;
        }

        public CredentialScope getScope() {
            return scope;
        }

        public void setScope(final CredentialScope theScope) {
            this.scope = theScope;
        }

        @Override
        public String toString() {
            return "SecretEntry[method=" + method + ", repository="
                    + repository + ", expiresAt=" + expiresAt + "]";
        }
    }

}
