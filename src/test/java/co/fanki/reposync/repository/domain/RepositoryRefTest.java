package co.fanki.reposync.repository.domain;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for RepositoryRef.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RepositoryRefTest {

    @Test
    void whenParsing_givenHttpsUrl_shouldExtractParts() {
        final RepositoryRef ref = RepositoryRef.parse(
                "https://github.com/acme/widgets.git");

        assertEquals("github.com", ref.host());
        assertEquals("acme", ref.owner());
        assertEquals("widgets", ref.name());
        assertEquals(Protocol.HTTPS, ref.protocol());
    }

    @Test
    void whenParsing_givenScpStyleSshUrl_shouldUseSsh() {
        final RepositoryRef ref = RepositoryRef.parse(
                "git@github.com:acme/widgets.git");

        assertEquals("widgets", ref.name());
        assertEquals(Protocol.SSH, ref.protocol());
    }

    @Test
    void whenParsing_givenSshSchemeUrl_shouldUseSsh() {
        final RepositoryRef ref = RepositoryRef.parse(
                "ssh://git@gitlab.example.com/team/service");

        assertEquals("gitlab.example.com", ref.host());
        assertEquals("team", ref.owner());
        assertEquals(Protocol.SSH, ref.protocol());
    }

    @Test
    void whenParsing_givenUrlWithoutGitSuffix_shouldKeepDotsInName() {
        final RepositoryRef ref = RepositoryRef.parse(
                "https://github.com/acme/widgets.io");

        assertEquals("widgets.io", ref.name());
    }

    @Test
    void whenParsing_givenGarbage_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> RepositoryRef.parse("not a url"));
        assertThrows(IllegalArgumentException.class,
                () -> RepositoryRef.parse("https://github.com/acme"));
    }

    @Test
    void whenParsingIdentifier_givenOwnerAndName_shouldUseDefaultHost() {
        final RepositoryRef ref = RepositoryRef.parseIdentifier("acme/widgets");

        assertEquals(RepositoryRef.of("github.com", "acme", "widgets"), ref);
    }

    @Test
    void whenParsingIdentifier_givenHostOwnerAndName_shouldUseHost() {
        final RepositoryRef ref = RepositoryRef.parseIdentifier(
                "gitlab.example.com/team/service");

        assertEquals("gitlab.example.com", ref.host());
    }

    @Test
    void whenComparing_givenDifferentProtocols_shouldBeEqual() {
        final RepositoryRef https = RepositoryRef.of("github.com", "acme",
                "widgets", Protocol.HTTPS);
        final RepositoryRef ssh = RepositoryRef.of("GitHub.com", "acme",
                "widgets", Protocol.SSH);

        assertEquals(https, ssh);
        assertEquals(https.hashCode(), ssh.hashCode());

        final Set<RepositoryRef> set = new HashSet<>();
        set.add(https);
        set.add(ssh);
        assertEquals(1, set.size());
    }

    @Test
    void whenComparing_givenDifferentOwners_shouldNotBeEqual() {
        assertNotEquals(RepositoryRef.of("github.com", "acme", "widgets"),
                RepositoryRef.of("github.com", "other", "widgets"));
    }

    @Test
    void whenCreating_givenPathTraversalName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> RepositoryRef.of("github.com", "acme", ".."));
        assertThrows(IllegalArgumentException.class,
                () -> RepositoryRef.of("github.com", "ac/me", "widgets"));
    }

    @Test
    void whenRenderingCloneUrl_givenProtocol_shouldMatchScheme() {
        final RepositoryRef ref = RepositoryRef.of("github.com", "acme",
                "widgets");

        assertEquals("https://github.com/acme/widgets.git", ref.cloneUrl());
        assertEquals("git@github.com:acme/widgets.git",
                ref.withProtocol(Protocol.SSH).cloneUrl());
    }

    @Test
    void whenSwitchingProtocol_givenSameProtocol_shouldReturnSameInstance() {
        final RepositoryRef ref = RepositoryRef.of("github.com", "acme",
                "widgets");

        assertSame(ref, ref.withProtocol(Protocol.HTTPS));
    }

    @Test
    void whenRenderingNames_givenRef_shouldUseIdentifierAndWorkspaceFormat() {
        final RepositoryRef ref = RepositoryRef.of("github.com", "acme",
                "widgets");

        assertEquals("github.com/acme/widgets", ref.identifier());
        assertEquals("acme_widgets", ref.workspaceDirectoryName());
        assertEquals("github.com/acme/widgets", ref.toString());
    }

}
