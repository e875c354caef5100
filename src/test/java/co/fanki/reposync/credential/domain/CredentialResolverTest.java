package co.fanki.reposync.credential.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for CredentialResolver.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CredentialResolverTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final RepositoryRef repo = RepositoryRef.of("github.com", "acme",
            "widgets");

    private InMemorySecretStore store;
    private CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemorySecretStore();
        resolver = new CredentialResolver(store,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void whenResolving_givenExpiredDeployKeyAndValidPat_shouldReturnPat() {
        store.put(repo, CredentialHandle.of(CredentialMethod.DEPLOY_KEY,
                "key", NOW.minusSeconds(60), CredentialScope.READ_ONLY));
        final CredentialHandle pat = CredentialHandle.of(CredentialMethod.PAT,
                "token", NOW.plusSeconds(3600), CredentialScope.READ_ONLY);
        store.putDefault(pat);

        final CredentialHandle result = resolver.resolve(repo,
                List.of(CredentialMethod.DEPLOY_KEY, CredentialMethod.PAT));

        assertSame(pat, result);
    }

    @Test
    void whenResolving_givenSeveralUsable_shouldHonourCallerOrder() {
        final CredentialHandle pat = CredentialHandle.of(CredentialMethod.PAT,
                "token", null, CredentialScope.READ_ONLY);
        final CredentialHandle app = CredentialHandle.of(
                CredentialMethod.GITHUB_APP_INSTALLATION, "app", null,
                CredentialScope.READ_ONLY);
        store.putDefault(pat);
        store.putDefault(app);

        final CredentialHandle result = resolver.resolve(repo, List.of(
                CredentialMethod.GITHUB_APP_INSTALLATION, CredentialMethod.PAT));

        assertSame(app, result);
    }

    @Test
    void whenResolving_givenRepositorySpecificAndDefault_shouldPreferSpecific() {
        final CredentialHandle specific = CredentialHandle.of(
                CredentialMethod.PAT, "specific", null, CredentialScope.READ_ONLY);
        store.putDefault(CredentialHandle.of(CredentialMethod.PAT, "default",
                null, CredentialScope.READ_ONLY));
        store.put(repo, specific);

        assertSame(specific, resolver.resolve(repo,
                List.of(CredentialMethod.PAT)));
    }

    @Test
    void whenResolving_givenNothingUsable_shouldThrowNoUsableCredential() {
        store.putDefault(CredentialHandle.of(CredentialMethod.PAT, "token",
                NOW, CredentialScope.READ_ONLY));

        final NoUsableCredentialException exception = assertThrows(
                NoUsableCredentialException.class,
                () -> resolver.resolve(repo, CredentialMethod.DEFAULT_PREFERENCE));

        assertEquals(ErrorKind.NO_USABLE_CREDENTIAL, exception.kind());
        assertEquals("NO_USABLE_CREDENTIAL", exception.getErrorCode());
    }

    @Test
    void whenResolving_givenAnonymousHint_shouldReturnAnonymousHandle() {
        final CredentialHandle result = resolver.resolve(repo,
                CredentialMethod.preferenceWith(CredentialMethod.ANONYMOUS));

        assertEquals(CredentialMethod.ANONYMOUS, result.method());
    }

    @Test
    void whenResolvingExcluding_givenTriedMethod_shouldReturnNextBest() {
        store.putDefault(CredentialHandle.of(CredentialMethod.FINE_GRAINED_PAT,
                "fine", null, CredentialScope.READ_ONLY));
        store.putDefault(CredentialHandle.of(CredentialMethod.PAT, "classic",
                null, CredentialScope.READ_ONLY));

        final Optional<CredentialHandle> result = resolver.resolveExcluding(
                repo, CredentialMethod.DEFAULT_PREFERENCE,
                Set.of(CredentialMethod.FINE_GRAINED_PAT));

        assertTrue(result.isPresent());
        assertEquals(CredentialMethod.PAT, result.get().method());
    }

    @Test
    void whenResolvingExcluding_givenOnlyTriedMethodStored_shouldReturnEmpty() {
        store.putDefault(CredentialHandle.of(CredentialMethod.PAT, "classic",
                null, CredentialScope.READ_ONLY));

        assertTrue(resolver.resolveExcluding(repo,
                CredentialMethod.DEFAULT_PREFERENCE,
                Set.of(CredentialMethod.PAT)).isEmpty());
    }

    @Test
    void whenResolving_givenStore_shouldOnlyReadCandidatesInOrder() {
        final SecretStore mockStore = createMock(SecretStore.class);
        expect(mockStore.get(CredentialMethod.DEPLOY_KEY, repo))
                .andReturn(Optional.empty());
        expect(mockStore.get(CredentialMethod.PAT, repo))
                .andReturn(Optional.of(CredentialHandle.of(CredentialMethod.PAT,
                        "token", null, CredentialScope.READ_ONLY)));
        replay(mockStore);

        final CredentialResolver mockResolver = new CredentialResolver(
                mockStore, Clock.fixed(NOW, ZoneOffset.UTC));
        final CredentialHandle result = mockResolver.resolve(repo, List.of(
                CredentialMethod.DEPLOY_KEY, CredentialMethod.PAT,
                CredentialMethod.COLLABORATOR_TOKEN));

        assertEquals(CredentialMethod.PAT, result.method());
        verify(mockStore);
    }

}
