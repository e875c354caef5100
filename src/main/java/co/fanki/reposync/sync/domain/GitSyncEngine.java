package co.fanki.reposync.sync.domain;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.repository.domain.WorkspaceLayout;
import co.fanki.reposync.repository.domain.WorkspaceLocks;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.OrchestrationException;
import co.fanki.reposync.shared.Preconditions;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.FetchCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.RepositoryCache;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.util.FS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * JGit based clone/sync engine.
 *
 * <p>Flow:</p>
 * <ol>
 *   <li>No watermark, no checkout or a forced re-clone: clone into a
 *       staging directory and swap it into place.</li>
 *   <li>Otherwise fetch all branch heads into {@code refs/remotes/origin}.</li>
 *   <li>Remote tip equals the watermark: return without touching the
 *       checkout.</li>
 *   <li>Watermark not an ancestor of the tip (force push, rewind): fall
 *       back to a re-clone.</li>
 *   <li>Diff the trees of watermark and tip, then fast-forward.</li>
 * </ol>
 *
 * <p>Fetching only writes objects and remote-tracking refs, so the
 * working tree is mutated in exactly two places: the fast-forward and
 * the swap of a finished clone. Both run under the repository's write
 * lock. A clone that fails or is cancelled only ever touched its
 * staging directory.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GitSyncEngine implements SyncEngine {

    private static final Logger LOG = LoggerFactory.getLogger(
            GitSyncEngine.class);

    private static final String ORIGIN = "origin";

    private static final RefSpec ALL_HEADS = new RefSpec(
            "+" + Constants.R_HEADS + "*:" + Constants.R_REMOTES + ORIGIN + "/*");

    private final WorkspaceLayout layout;
    private final WorkspaceLocks locks;
    private final GitAuthentication authentication;
    private final Function<RepositoryRef, String> remoteUrls;
    private final Duration transferTimeout;
    private final Clock clock;

    /**
     * Creates a new GitSyncEngine.
     *
     * @param theLayout where checkouts live
     * @param theLocks the per-repository workspace locks
     * @param theAuthentication maps credentials to transport settings
     * @param theRemoteUrls resolves the URL to fetch a repository from
     * @param theTransferTimeout idle timeout of clones and fetches
     * @param theClock the clock used for watermarks and durations
     */
    public GitSyncEngine(
            final WorkspaceLayout theLayout,
            final WorkspaceLocks theLocks,
            final GitAuthentication theAuthentication,
            final Function<RepositoryRef, String> theRemoteUrls,
            final Duration theTransferTimeout,
            final Clock theClock) {
        this.layout = Preconditions.requireNonNull(theLayout,
                "Workspace layout is required");
        this.locks = Preconditions.requireNonNull(theLocks,
                "Workspace locks are required");
        this.authentication = Preconditions.requireNonNull(theAuthentication,
                "Git authentication is required");
        this.remoteUrls = Preconditions.requireNonNull(theRemoteUrls,
                "Remote URL resolver is required");
        this.transferTimeout = Preconditions.requirePositive(theTransferTimeout,
                "Transfer timeout must be positive");
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
    }

    @Override
    public SyncResult sync(final SyncRequest request) {
        final Instant started = clock.instant();
        final RepositoryRef repo = request.repository();
        final Path checkout = layout.checkoutOf(repo);
        final Watermark previous = request.previousWatermark();

        if (request.forceReclone()) {
            LOG.info("Forced re-clone of {}", repo);
            return fullClone(request, checkout, started);
        }
        if (previous == null) {
            LOG.info("No watermark for {}, performing initial clone", repo);
            return fullClone(request, checkout, started);
        }
        if (!Files.exists(checkout)) {
            LOG.info("No checkout of {} at {}, cloning", repo, checkout);
            return fullClone(request, checkout, started);
        }

        try {
            return incremental(request, checkout, started);
        } catch (final DivergedHistoryException e) {
            LOG.warn("History of {} diverged from watermark {} ({}),"
                    + " falling back to a full re-clone",
                    repo, previous.commitId(), e.getMessage());
            return fullClone(request, checkout, started);
        }
    }

    /**
     * Removes staging directories left behind by an interrupted process.
     *
     * <p>Must be called before any sync runs.</p>
     */
    public void purgeStaleStaging() {
        final Path staging = layout.stagingRoot();
        if (Files.exists(staging)) {
            LOG.info("Purging stale staging directory {}", staging);
            deleteRecursively(staging);
        }
    }

    private SyncResult incremental(final SyncRequest request,
            final Path checkout, final Instant started)
            throws DivergedHistoryException {

        final RepositoryRef repo = request.repository();
        final Watermark previous = request.previousWatermark();

        try (Git git = openCheckout(repo, checkout)) {
            final Repository repository = git.getRepository();
            final String branch = repository.getBranch();
            if (branch == null || ObjectId.isId(branch)) {
                throw new CorruptWorkspaceException("Checkout of " + repo
                        + " is not on a branch", null);
            }

            fetch(git, request);

            final ObjectId remoteTip = repository.resolve(
                    Constants.R_REMOTES + ORIGIN + "/" + branch);
            if (remoteTip == null) {
                throw new DivergedHistoryException(
                        "branch " + branch + " no longer exists on the remote");
            }

            if (previous.isAt(remoteTip.getName())) {
                LOG.info("No changes detected for {} (tip: {})",
                        repo, remoteTip.getName());
                return SyncResult.noChange(previous, elapsedSince(started));
            }

            final ObjectId previousId = resolveWatermark(repo, repository,
                    previous);

            final Set<String> changedPaths;
            try (RevWalk walk = new RevWalk(repository)) {
                final RevCommit previousCommit = walk.parseCommit(previousId);
                final RevCommit tipCommit = walk.parseCommit(remoteTip);
                if (!walk.isMergedInto(previousCommit, tipCommit)) {
                    throw new DivergedHistoryException("watermark "
                            + previous.commitId() + " is not an ancestor of "
                            + remoteTip.getName());
                }
                changedPaths = diffPaths(git, repo, repository,
                        previousCommit, tipCommit);
            }

            checkNotCancelled(repo, request.cancellation());
            fastForward(git, repo, remoteTip);

            final Watermark after = Watermark.at(remoteTip.getName(),
                    clock.instant());
            LOG.info("Synced {} from {} to {}: {} changed paths", repo,
                    previous.commitId(), after.commitId(), changedPaths.size());
            return SyncResult.incremental(previous, after, changedPaths,
                    elapsedSince(started));

        } catch (final GitAPIException | JGitInternalException e) {
            throw GitFailureClassifier.classify(repo, e, request.cancellation());
        } catch (final IOException e) {
            throw new CorruptWorkspaceException("Cannot read checkout of "
                    + repo + ": " + e.getMessage(), e);
        }
    }

    private Git openCheckout(final RepositoryRef repo, final Path checkout) {
        final Path metadata = checkout.resolve(Constants.DOT_GIT);
        if (!RepositoryCache.FileKey.isGitRepository(metadata.toFile(),
                FS.DETECTED)) {
            throw new CorruptWorkspaceException("Checkout of " + repo + " at "
                    + checkout + " has no usable " + Constants.DOT_GIT
                    + " directory", null);
        }
        try {
            return Git.open(checkout.toFile());
        } catch (final IOException e) {
            throw new CorruptWorkspaceException("Cannot open checkout of "
                    + repo + ": " + e.getMessage(), e);
        }
    }

    private void fetch(final Git git, final SyncRequest request)
            throws GitAPIException {
        final CredentialHandle credential = request.credential();
        final FetchCommand fetch = git.fetch()
                .setRemote(remoteUrlFor(request))
                .setRefSpecs(ALL_HEADS)
                .setRemoveDeletedRefs(true)
                .setTimeout(timeoutSeconds())
                .setProgressMonitor(new CancellableProgressMonitor(
                        request.cancellation()));
        try (GitAuthentication.Session session = authentication.open(credential)) {
            session.configure(fetch);
            fetch.call();
        }
        checkNotCancelled(request.repository(), request.cancellation());
    }

    private ObjectId resolveWatermark(final RepositoryRef repo,
            final Repository repository, final Watermark previous)
            throws IOException {
        final ObjectId id;
        try {
            id = repository.resolve(previous.commitId());
        } catch (final RuntimeException e) {
            throw new CorruptWorkspaceException("Watermark " + previous.commitId()
                    + " of " + repo + " cannot be resolved", e);
        }
        if (id == null || !repository.getObjectDatabase().has(id)) {
            throw new CorruptWorkspaceException("Watermark commit "
                    + previous.commitId() + " is missing from checkout of "
                    + repo, null);
        }
        return id;
    }

    private void fastForward(final Git git, final RepositoryRef repo,
            final ObjectId remoteTip) throws DivergedHistoryException {
        final Lock lock = locks.writeLock(repo);
        lock.lock();
        try {
            final MergeResult merge = git.merge()
                    .include(remoteTip)
                    .setFastForward(MergeCommand.FastForwardMode.FF_ONLY)
                    .setCommit(true)
                    .call();
            if (!merge.getMergeStatus().isSuccessful()) {
                throw new DivergedHistoryException("fast-forward to "
                        + remoteTip.getName() + " not possible: "
                        + merge.getMergeStatus());
            }
        } catch (final GitAPIException | JGitInternalException e) {
            throw new CorruptWorkspaceException("Cannot fast-forward checkout of "
                    + repo + " to " + remoteTip.getName() + ": "
                    + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private SyncResult fullClone(final SyncRequest request,
            final Path checkout, final Instant started) {

        final RepositoryRef repo = request.repository();
        final Watermark previous = request.previousWatermark();
        final Path staging = layout.newStagingDirectory(repo);

        LOG.info("Cloning {} into {}", repo, staging);

        try {
            Files.createDirectories(staging.getParent());

            final CloneCommand clone = Git.cloneRepository()
                    .setURI(remoteUrlFor(request))
                    .setDirectory(staging.toFile())
                    .setTimeout(timeoutSeconds())
                    .setProgressMonitor(new CancellableProgressMonitor(
                            request.cancellation()));

            final String tip;
            final Set<String> allPaths;
            try (GitAuthentication.Session session =
                         authentication.open(request.credential())) {
                session.configure(clone);
                try (Git git = clone.call()) {
                    checkNotCancelled(repo, request.cancellation());
                    final Repository repository = git.getRepository();
                    final ObjectId head = repository.resolve(Constants.HEAD);
                    if (head == null) {
                        throw new OrchestrationException(ErrorKind.INTERNAL,
                                "Remote repository " + repo + " has no commits");
                    }
                    tip = head.getName();
                    allPaths = listFiles(repository, head);
                }
            }

            swapIntoPlace(repo, staging, checkout);

            final Watermark after = Watermark.at(tip, clock.instant());
            final SyncMode mode = previous == null
                    ? SyncMode.INITIAL_CLONE : SyncMode.RECLONE;

            LOG.info("Clone of {} completed at {} ({} files, {})",
                    repo, tip, allPaths.size(), mode);
            return SyncResult.full(previous, after, allPaths, mode,
                    elapsedSince(started));

        } catch (final GitAPIException | JGitInternalException e) {
            throw GitFailureClassifier.classify(repo, e, request.cancellation());
        } catch (final IOException e) {
            throw new CorruptWorkspaceException("Cannot materialize checkout of "
                    + repo + ": " + e.getMessage(), e);
        } finally {
            if (Files.exists(staging)) {
                deleteRecursively(staging);
            }
        }
    }

    private void swapIntoPlace(final RepositoryRef repo, final Path staging,
            final Path checkout) throws IOException {
        final Lock lock = locks.writeLock(repo);
        lock.lock();
        try {
            Path retired = null;
            if (Files.exists(checkout)) {
                retired = layout.newStagingDirectory(repo);
                Files.move(checkout, retired, StandardCopyOption.ATOMIC_MOVE);
            }
            try {
                Files.move(staging, checkout, StandardCopyOption.ATOMIC_MOVE);
            } catch (final IOException e) {
                if (retired != null) {
                    Files.move(retired, checkout, StandardCopyOption.ATOMIC_MOVE);
                }
                throw e;
            }
            if (retired != null) {
                deleteRecursively(retired);
            }
        } finally {
            lock.unlock();
        }
    }

    private Set<String> diffPaths(final Git git, final RepositoryRef repo,
            final Repository repository, final RevCommit oldCommit,
            final RevCommit newCommit) throws IOException {

        final List<DiffEntry> diffs;
        try {
            diffs = git.diff()
                    .setOldTree(prepareTreeParser(repository, oldCommit))
                    .setNewTree(prepareTreeParser(repository, newCommit))
                    .setShowNameAndStatusOnly(true)
                    .call();
        } catch (final GitAPIException | JGitInternalException e) {
            throw new CorruptWorkspaceException("Cannot diff checkout of "
                    + repo + ": " + e.getMessage(), e);
        }

        final Set<String> paths = new TreeSet<>();
        for (final DiffEntry entry : diffs) {
            switch (entry.getChangeType()) {
                case ADD, MODIFY, COPY -> paths.add(entry.getNewPath());
                case DELETE -> paths.add(entry.getOldPath());
                case RENAME -> {
                    paths.add(entry.getOldPath());
                    paths.add(entry.getNewPath());
                }
            }
        }
        return paths;
    }

    private AbstractTreeIterator prepareTreeParser(final Repository repository,
            final RevCommit commit) throws IOException {
        final CanonicalTreeParser parser = new CanonicalTreeParser();
        try (ObjectReader reader = repository.newObjectReader()) {
            parser.reset(reader, commit.getTree().getId());
        }
        return parser;
    }

    private Set<String> listFiles(final Repository repository,
            final ObjectId head) throws IOException {
        final Set<String> paths = new TreeSet<>();
        try (RevWalk walk = new RevWalk(repository);
             TreeWalk treeWalk = new TreeWalk(repository)) {
            final RevCommit commit = walk.parseCommit(head);
            treeWalk.addTree(commit.getTree());
            treeWalk.setRecursive(true);
            while (treeWalk.next()) {
                paths.add(treeWalk.getPathString());
            }
        }
        return paths;
    }

    private String remoteUrlFor(final SyncRequest request) {
        final RepositoryRef repo = request.repository();
        return remoteUrls.apply(repo.withProtocol(
                request.credential().method().transportFor(repo.protocol())));
    }

    private int timeoutSeconds() {
        return (int) Math.max(1, transferTimeout.toSeconds());
    }

    private Duration elapsedSince(final Instant started) {
        return Duration.between(started, clock.instant());
    }

    private static void checkNotCancelled(final RepositoryRef repo,
            final CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            throw new SyncCancelledException("Sync of " + repo
                    + " was cancelled", null);
        }
    }

    private static void deleteRecursively(final Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (final IOException e) {
                            LOG.warn("Failed to delete: {}", path);
                        }
                    });
        } catch (final IOException e) {
            LOG.warn("Failed to clean up {}", root, e);
        }
    }

    /**
     * Raised internally when the incremental path cannot be applied; the
     * engine answers it with a re-clone.
     */
    private static final class DivergedHistoryException extends Exception {

        private static final long serialVersionUID = 1L;

        DivergedHistoryException(final String message) {
            super(message);
        }

    }

}
