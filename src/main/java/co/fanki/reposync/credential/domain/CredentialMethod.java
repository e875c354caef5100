package co.fanki.reposync.credential.domain;

import co.fanki.reposync.repository.domain.Protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed set of ways the orchestrator can authenticate against a git host.
 *
 * <p>Each method is a tag; the secret behind it lives in a
 * {@link SecretStore}. Methods are tried in a preference order rather
 * than selected by hardcoded branching.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum CredentialMethod {

    /** Session token obtained after accepting a collaborator invitation. */
    COLLABORATOR_TOKEN(Protocol.HTTPS),

    /** Classic, account wide personal access token. */
    PAT(Protocol.HTTPS),

    /** Repository scoped fine-grained personal access token. */
    FINE_GRAINED_PAT(Protocol.HTTPS),

    /** Repository scoped SSH key. */
    DEPLOY_KEY(Protocol.SSH),

    /** Short lived token of a GitHub App installation. */
    GITHUB_APP_INSTALLATION(Protocol.HTTPS),

    /** No authentication, for public repositories. */
    ANONYMOUS(null);

    /**
     * Order used when the caller does not state a preference.
     *
     * <p>Narrowest credential first. {@link #ANONYMOUS} is never part of
     * it; it is only tried when discovery hints at a public repository.</p>
     */
    public static final List<CredentialMethod> DEFAULT_PREFERENCE = List.of(
            DEPLOY_KEY,
            FINE_GRAINED_PAT,
            PAT,
            COLLABORATOR_TOKEN,
            GITHUB_APP_INSTALLATION);

    private final Protocol requiredProtocol;

    CredentialMethod(final Protocol theRequiredProtocol) {
        this.requiredProtocol = theRequiredProtocol;
    }

    /**
     * Returns the default preference with the hinted method tried first.
     *
     * @param hint the access method discovery suggested, may be null
     * @return the candidate list, never empty
     */
    public static List<CredentialMethod> preferenceWith(
            final CredentialMethod hint) {
        if (hint == null) {
            return DEFAULT_PREFERENCE;
        }
        final List<CredentialMethod> candidates = new ArrayList<>();
        candidates.add(hint);
        for (final CredentialMethod method : DEFAULT_PREFERENCE) {
            if (method != hint) {
                candidates.add(method);
            }
        }
        return List.copyOf(candidates);
    }

    /**
     * Resolves the transport this method has to use.
     *
     * @param preferred the repository's preferred protocol
     * @return the protocol to connect with
     */
    public Protocol transportFor(final Protocol preferred) {
        return requiredProtocol != null ? requiredProtocol : preferred;
    }

    /**
     * Checks whether this method needs a secret at all.
     *
     * @return false only for {@link #ANONYMOUS}
     */
    public boolean requiresSecret() {
        return this != ANONYMOUS;
    }

}
