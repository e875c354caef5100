package co.fanki.reposync.credential.domain;

import co.fanki.reposync.shared.Preconditions;

import java.time.Instant;

/**
 * Opaque, method tagged reference to a secret.
 *
 * <p>Only the tag, the expiry and the scope are observable. The secret
 * is handed out to the transport layer through {@link #secret()} and is
 * never part of {@link #toString()}, equality, reports or logs. Handles
 * live in process memory only; nothing persists them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CredentialHandle {

    private static final CredentialHandle ANONYMOUS = new CredentialHandle(
            CredentialMethod.ANONYMOUS, "", null, CredentialScope.READ_ONLY);

    private final CredentialMethod method;
    private final String secret;
    private final Instant expiresAt;
    private final CredentialScope scope;

    private CredentialHandle(final CredentialMethod theMethod,
            final String theSecret, final Instant theExpiresAt,
            final CredentialScope theScope) {
        this.method = Preconditions.requireNonNull(theMethod,
                "Credential method is required");
        this.secret = theSecret;
        this.expiresAt = theExpiresAt;
        this.scope = Preconditions.requireNonNull(theScope,
                "Credential scope is required");
    }

    /**
     * Creates a handle for a secret.
     *
     * @param method the method tag, not {@link CredentialMethod#ANONYMOUS}
     * @param secret the token or private key, not blank
     * @param expiresAt when the secret stops working, null if never
     * @param scope what the secret allows
     * @return the handle
     */
    public static CredentialHandle of(final CredentialMethod method,
            final String secret, final Instant expiresAt,
            final CredentialScope scope) {
        Preconditions.require(method != CredentialMethod.ANONYMOUS,
                "Use anonymous() for public repositories");
        Preconditions.requireNonBlank(secret, "Credential secret is required");
        return new CredentialHandle(method, secret, expiresAt, scope);
    }

    /**
     * Returns the handle used for public repositories.
     *
     * @return the shared anonymous handle
     */
    public static CredentialHandle anonymous() {
        return ANONYMOUS;
    }

    /**
     * Checks whether the handle has expired at the given instant.
     *
     * @param now the reference instant
     * @return true if an expiry is set and is not after {@code now}
     */
    public boolean isExpiredAt(final Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Returns the raw secret for transport configuration.
     *
     * @return the secret, empty for anonymous access
     */
    public String secret() {
        return secret;
    }

    public CredentialMethod method() {
        return method;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public CredentialScope scope() {
        return scope;
    }

    @Override
    public String toString() {
        return "CredentialHandle[method=" + method
                + ", expiresAt=" + expiresAt
                + ", scope=" + scope + "]";
    }

}
