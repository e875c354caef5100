package co.fanki.reposync.sync.domain;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.repository.domain.WorkspaceLayout;
import co.fanki.reposync.repository.domain.WorkspaceLocks;
import co.fanki.reposync.shared.OrchestrationException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for GitSyncEngine against real repositories on the local file
 * system.
 *
 * <p>The remote is a plain repository under a temporary directory; the
 * engine reaches it through the file transport with anonymous
 * access.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GitSyncEngineTest {

    @TempDir
    Path tempDir;

    private final RepositoryRef repo = RepositoryRef.of("github.com", "acme",
            "widgets");

    private Path remoteDir;
    private Git remote;
    private WorkspaceLayout layout;
    private GitSyncEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        remoteDir = tempDir.resolve("remotes").resolve("widgets");
        Files.createDirectories(remoteDir);
        remote = Git.init().setDirectory(remoteDir.toFile()).call();

        layout = new WorkspaceLayout(tempDir.resolve("workspace"));
        engine = new GitSyncEngine(layout, new WorkspaceLocks(),
                new GitAuthentication(),
                ref -> tempDir.resolve("remotes").resolve(ref.name())
                        .toString(),
                Duration.ofSeconds(30), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        remote.close();
    }

    @Test
    void whenSyncing_givenNoWatermark_shouldCloneAndListEveryFile()
            throws Exception {
        write("README.md", "hello");
        write("src/Main.java", "class Main {}");
        final RevCommit tip = commit("initial");

        final SyncResult result = engine.sync(request(null, false));

        assertEquals(SyncMode.INITIAL_CLONE, result.mode());
        assertTrue(result.isFull());
        assertNull(result.before());
        assertEquals(tip.getName(), result.after().commitId());
        assertEquals(List.of("README.md", "src/Main.java"),
                result.changedPaths());
        assertEquals("hello", Files.readString(
                layout.checkoutOf(repo).resolve("README.md")));
    }

    @Test
    void whenSyncing_givenWatermarkAtRemoteTip_shouldReturnNoChange()
            throws Exception {
        write("README.md", "hello");
        commit("initial");
        final SyncResult first = engine.sync(request(null, false));

        final SyncResult second = engine.sync(request(first.after(), false));

        assertEquals(SyncMode.NO_CHANGE, second.mode());
        assertTrue(second.isNoOp());
        assertTrue(second.changedPaths().isEmpty());
        assertEquals(first.after(), second.after());
    }

    @Test
    void whenSyncing_givenNewCommits_shouldReturnChangedPathsAndFastForward()
            throws Exception {
        write("a.txt", "one");
        write("b.txt", "two");
        commit("initial");
        final SyncResult first = engine.sync(request(null, false));

        write("a.txt", "one, edited");
        write("c.txt", "three");
        remote.rm().addFilepattern("b.txt").call();
        final RevCommit tip = commit("second");

        final SyncResult second = engine.sync(request(first.after(), false));

        assertEquals(SyncMode.INCREMENTAL, second.mode());
        assertEquals(first.after(), second.before());
        assertEquals(tip.getName(), second.after().commitId());
        assertEquals(List.of("a.txt", "b.txt", "c.txt"),
                second.changedPaths());

        final Path checkout = layout.checkoutOf(repo);
        assertEquals("one, edited", Files.readString(checkout.resolve("a.txt")));
        assertFalse(Files.exists(checkout.resolve("b.txt")));
        assertTrue(Files.exists(checkout.resolve("c.txt")));
    }

    @Test
    void whenSyncing_givenRewrittenRemoteHistory_shouldReclone()
            throws Exception {
        write("a.txt", "one");
        final RevCommit base = commit("initial");
        write("b.txt", "two");
        commit("second");
        final SyncResult first = engine.sync(request(null, false));

        remote.reset().setMode(ResetCommand.ResetType.HARD)
                .setRef(base.getName()).call();
        write("z.txt", "rewritten");
        final RevCommit rewritten = commit("rewritten");

        final SyncResult second = engine.sync(request(first.after(), false));

        assertEquals(SyncMode.RECLONE, second.mode());
        assertEquals(first.after(), second.before());
        assertEquals(rewritten.getName(), second.after().commitId());
        assertEquals(List.of("a.txt", "z.txt"), second.changedPaths());
        assertFalse(Files.exists(layout.checkoutOf(repo).resolve("b.txt")));
    }

    @Test
    void whenSyncing_givenForcedReclone_shouldReplaceCheckout()
            throws Exception {
        write("a.txt", "one");
        commit("initial");
        final SyncResult first = engine.sync(request(null, false));
        Files.writeString(layout.checkoutOf(repo).resolve("stray.tmp"), "x");

        final SyncResult second = engine.sync(request(first.after(), true));

        assertEquals(SyncMode.RECLONE, second.mode());
        assertFalse(Files.exists(layout.checkoutOf(repo).resolve("stray.tmp")));
        assertTrue(isEmptyOrMissing(layout.stagingRoot()));
    }

    @Test
    void whenSyncing_givenMissingGitDirectory_shouldReportCorruptWorkspace()
            throws Exception {
        write("a.txt", "one");
        commit("initial");
        final SyncResult first = engine.sync(request(null, false));
        deleteRecursively(layout.checkoutOf(repo).resolve(".git"));

        assertThrows(CorruptWorkspaceException.class,
                () -> engine.sync(request(first.after(), false)));
    }

    @Test
    void whenSyncing_givenLocallyEditedCheckout_shouldReportCorruptWorkspace()
            throws Exception {
        write("a.txt", "one");
        commit("initial");
        final SyncResult first = engine.sync(request(null, false));
        final Path checkout = layout.checkoutOf(repo);
        Files.writeString(checkout.resolve("a.txt"), "local edit",
                StandardCharsets.UTF_8);

        write("a.txt", "remote edit");
        final RevCommit tip = commit("second");

        final CorruptWorkspaceException error = assertThrows(
                CorruptWorkspaceException.class,
                () -> engine.sync(request(first.after(), false)));
        assertEquals("CORRUPT_WORKSPACE", error.getErrorCode());

        final SyncResult recovered = engine.sync(request(first.after(), true));

        assertEquals(SyncMode.RECLONE, recovered.mode());
        assertEquals(tip.getName(), recovered.after().commitId());
        assertEquals("remote edit", Files.readString(checkout.resolve("a.txt")));
    }

    @Test
    void whenSyncing_givenWatermarkMissingFromCheckout_shouldReportCorruptWorkspace()
            throws Exception {
        write("a.txt", "one");
        commit("initial");
        engine.sync(request(null, false));
        write("a.txt", "two");
        commit("second");

        final Watermark unknown = Watermark.at(
                "0123456789abcdef0123456789abcdef01234567", Instant.now());

        assertThrows(CorruptWorkspaceException.class,
                () -> engine.sync(request(unknown, false)));
    }

    @Test
    void whenSyncing_givenCancelledToken_shouldLeaveNoCheckout()
            throws Exception {
        write("a.txt", "one");
        commit("initial");
        final CancellationToken cancelled = new CancellationToken();
        cancelled.cancel();

        assertThrows(SyncCancelledException.class, () -> engine.sync(
                new SyncRequest(repo, CredentialHandle.anonymous(), null,
                        false, cancelled)));

        assertFalse(Files.exists(layout.checkoutOf(repo)));
        assertTrue(isEmptyOrMissing(layout.stagingRoot()));
    }

    @Test
    void whenSyncing_givenUnreachableRemote_shouldNotCreateCheckout() {
        final RepositoryRef missing = RepositoryRef.of("github.com", "acme",
                "missing");

        assertThrows(OrchestrationException.class,
                () -> engine.sync(new SyncRequest(missing,
                        CredentialHandle.anonymous(), null, false,
                        new CancellationToken())));

        assertFalse(Files.exists(layout.checkoutOf(missing)));
    }

    @Test
    void whenPurgingStaging_givenLeftovers_shouldRemoveThem() throws Exception {
        final Path leftover = layout.newStagingDirectory(repo);
        Files.createDirectories(leftover.resolve("partial"));

        engine.purgeStaleStaging();

        assertFalse(Files.exists(layout.stagingRoot()));
    }

    private SyncRequest request(final Watermark previous,
            final boolean forceReclone) {
        return new SyncRequest(repo, CredentialHandle.anonymous(), previous,
                forceReclone, new CancellationToken());
    }

    private void write(final String path, final String content)
            throws IOException {
        final Path file = remoteDir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private RevCommit commit(final String message) throws Exception {
        remote.add().addFilepattern(".").call();
        return remote.commit()
                .setMessage(message)
                .setAuthor("Test", "test@example.com")
                .setCommitter("Test", "test@example.com")
                .call();
    }

    private static boolean isEmptyOrMissing(final Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return true;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    private static void deleteRecursively(final Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            for (final Path path : paths.sorted(Comparator.reverseOrder())
                    .toList()) {
                Files.delete(path);
            }
        }
    }

}
