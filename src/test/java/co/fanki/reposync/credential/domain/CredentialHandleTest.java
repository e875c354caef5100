package co.fanki.reposync.credential.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for CredentialHandle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CredentialHandleTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void whenRendering_givenToken_shouldNeverRevealSecret() {
        final CredentialHandle handle = CredentialHandle.of(
                CredentialMethod.PAT, "ghp_supersecret", NOW,
                CredentialScope.READ_ONLY);

        final String text = handle.toString();

        assertFalse(text.contains("ghp_supersecret"));
        assertTrue(text.contains("PAT"));
        assertTrue(text.contains(NOW.toString()));
    }

    @Test
    void whenCheckingExpiry_givenExpiryAtNow_shouldBeExpired() {
        final CredentialHandle handle = CredentialHandle.of(
                CredentialMethod.PAT, "token", NOW, CredentialScope.READ_ONLY);

        assertTrue(handle.isExpiredAt(NOW));
        assertFalse(handle.isExpiredAt(NOW.minusSeconds(1)));
    }

    @Test
    void whenCheckingExpiry_givenNoExpiry_shouldNeverExpire() {
        final CredentialHandle handle = CredentialHandle.of(
                CredentialMethod.PAT, "token", null, CredentialScope.READ_ONLY);

        assertFalse(handle.isExpiredAt(Instant.MAX));
    }

    @Test
    void whenCreating_givenBlankSecretOrAnonymousMethod_shouldThrowException() {
        assertThrows(IllegalArgumentException.class, () -> CredentialHandle.of(
                CredentialMethod.PAT, " ", null, CredentialScope.READ_ONLY));
        assertThrows(IllegalArgumentException.class, () -> CredentialHandle.of(
                CredentialMethod.ANONYMOUS, "x", null, CredentialScope.READ_ONLY));
    }

}
