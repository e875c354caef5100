package co.fanki.reposync.job.application;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.credential.domain.CredentialResolver;
import co.fanki.reposync.credential.domain.NoUsableCredentialException;
import co.fanki.reposync.job.domain.Job;
import co.fanki.reposync.job.domain.JobError;
import co.fanki.reposync.job.domain.JobRepository;
import co.fanki.reposync.job.domain.ReanalysisRequest;
import co.fanki.reposync.job.domain.ReanalysisTrigger;
import co.fanki.reposync.job.domain.RetryPolicy;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.Preconditions;
import co.fanki.reposync.sync.domain.AuthException;
import co.fanki.reposync.sync.domain.CancellationToken;
import co.fanki.reposync.sync.domain.CorruptWorkspaceException;
import co.fanki.reposync.sync.domain.NetworkException;
import co.fanki.reposync.sync.domain.SyncCancelledException;
import co.fanki.reposync.sync.domain.SyncEngine;
import co.fanki.reposync.sync.domain.SyncRequest;
import co.fanki.reposync.sync.domain.SyncResult;
import co.fanki.reposync.workflow.domain.WorkflowReport;
import co.fanki.reposync.workflow.domain.WorkflowReportLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Drives one job through a complete pass.
 *
 * <p>Flow:</p>
 * <ol>
 *   <li>Resolve a credential; none usable ends the pass as FAILED.</li>
 *   <li>Sync, holding one of the global sync permits.</li>
 *   <li>On a network failure, back off and retry until the attempts run
 *       out.</li>
 *   <li>On an auth rejection, retry once with the next-best
 *       credential.</li>
 *   <li>On a corrupt workspace, retry once with a forced re-clone.</li>
 *   <li>On success, hand the changed paths over to re-analysis.</li>
 *   <li>Append exactly one report for the pass.</li>
 * </ol>
 *
 * <p>The caller guarantees that no two passes of the same job run at the
 * same time. Failures are recorded on the job and in the report; nothing
 * is thrown back to the caller.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JobRunner {

    private static final Logger LOG = LoggerFactory.getLogger(JobRunner.class);

    private static final long PERMIT_POLL_MILLIS = 200;

    private final CredentialResolver credentialResolver;
    private final SyncEngine syncEngine;
    private final RetryPolicy retryPolicy;
    private final ReanalysisTrigger reanalysisTrigger;
    private final JobRepository jobRepository;
    private final WorkflowReportLog reportLog;
    private final Semaphore syncPermits;
    private final Clock clock;

    /**
     * Creates a new JobRunner.
     *
     * @param theCredentialResolver picks credentials
     * @param theSyncEngine clones and fetches
     * @param theRetryPolicy attempt limit and backoff
     * @param theReanalysisTrigger receives changed paths
     * @param theJobRepository stores job progress
     * @param theReportLog receives one report per pass
     * @param theMaxConcurrentSyncs how many syncs may run at once
     * @param theClock the clock used for report timestamps
     */
    public JobRunner(
            final CredentialResolver theCredentialResolver,
            final SyncEngine theSyncEngine,
            final RetryPolicy theRetryPolicy,
            final ReanalysisTrigger theReanalysisTrigger,
            final JobRepository theJobRepository,
            final WorkflowReportLog theReportLog,
            final int theMaxConcurrentSyncs,
            final Clock theClock) {
        this.credentialResolver = Preconditions.requireNonNull(
                theCredentialResolver, "Credential resolver is required");
        this.syncEngine = Preconditions.requireNonNull(theSyncEngine,
                "Sync engine is required");
        this.retryPolicy = Preconditions.requireNonNull(theRetryPolicy,
                "Retry policy is required");
        this.reanalysisTrigger = Preconditions.requireNonNull(
                theReanalysisTrigger, "Reanalysis trigger is required");
        this.jobRepository = Preconditions.requireNonNull(theJobRepository,
                "Job repository is required");
        this.reportLog = Preconditions.requireNonNull(theReportLog,
                "Report log is required");
        this.syncPermits = new Semaphore(Preconditions.requirePositive(
                theMaxConcurrentSyncs, "Max concurrent syncs must be positive"),
                true);
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
    }

    /**
     * Runs one pass of a job.
     *
     * @param job the job, pending or finished with its previous pass
     * @param cancellation the shutdown signal
     * @return the report appended for the pass
     */
    public WorkflowReport runPass(final Job job,
            final CancellationToken cancellation) {

        final Instant startedAt = clock.instant();
        final RepositoryRef repo = job.repository();
        job.rearm();

        SyncResult result = null;
        try {
            if (cancellation.isCancelled()) {
                LOG.info("Shutdown in progress, not starting pass for {}", repo);
                job.interrupt();
            } else {
                result = drive(job, cancellation);
            }
        } catch (final SyncCancelledException e) {
            LOG.info("Pass for {} cancelled in state {}", repo, job.state());
            job.interrupt();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Worker interrupted, aborting pass for {}", repo);
            job.interrupt();
        } catch (final RuntimeException e) {
            LOG.error("Unexpected error in pass for {}: {}",
                    repo, e.getMessage(), e);
            if (!job.state().isTerminal()) {
                job.fail(new JobError(ErrorKind.INTERNAL, e.getMessage()));
            }
        }

        final WorkflowReport report = WorkflowReport.of(job, result,
                startedAt, clock.instant());
        checkpoint(job);
        try {
            reportLog.append(report);
        } catch (final RuntimeException e) {
            LOG.error("Failed to append report {} for {}: {}",
                    report.id(), repo, e.getMessage(), e);
        }

        LOG.info("Pass for {} ended {} after {} attempt(s): {} changed paths,"
                        + " error={}",
                repo, report.state(), report.attempts(),
                report.changedPathCount(), report.errorKind());
        return report;
    }

    private SyncResult drive(final Job job,
            final CancellationToken cancellation) throws InterruptedException {

        final RepositoryRef repo = job.repository();
        job.dispatch();
        checkpoint(job);

        final List<CredentialMethod> candidates = job.credentialCandidates();
        CredentialHandle credential;
        try {
            credential = credentialResolver.resolve(repo, candidates);
        } catch (final NoUsableCredentialException e) {
            LOG.warn("No usable credential for {} among {}", repo, candidates);
            job.fail(JobError.of(e));
            return null;
        }

        final Set<CredentialMethod> tried = EnumSet.of(credential.method());
        boolean credentialSwitched = false;
        boolean recloneForced = false;

        while (true) {
            job.startSyncAttempt(credential.method());
            checkpoint(job);
            LOG.info("Sync attempt {} for {} with {}", job.attempt(), repo,
                    credential.method());

            try {
                final SyncResult result = syncWithPermit(job, credential,
                        recloneForced, cancellation);
                job.syncSucceeded(result);
                checkpoint(job);
                handOff(repo, result);
                job.reanalysisHandedOff();
                return result;

            } catch (final NetworkException e) {
                if (!retryPolicy.canRetry(job.attempt())) {
                    LOG.warn("Giving up on {} after {} attempts: {}",
                            repo, job.attempt(), e.getMessage());
                    job.fail(JobError.of(e));
                    return null;
                }
                job.retryScheduled(JobError.of(e));
                checkpoint(job);
                final Duration delay = retryPolicy.backoff(job.attempt());
                LOG.info("Network failure syncing {}, retrying in {} ms: {}",
                        repo, delay.toMillis(), e.getMessage());
                if (cancellation.awaitCancellation(delay)) {
                    throw new SyncCancelledException(
                            "Backoff of " + repo + " cancelled", e);
                }

            } catch (final AuthException e) {
                final Optional<CredentialHandle> alternative =
                        credentialSwitched || !retryPolicy.canRetry(job.attempt())
                                ? Optional.empty()
                                : credentialResolver.resolveExcluding(repo,
                                        candidates, tried);
                if (alternative.isEmpty()) {
                    LOG.warn("Credential {} rejected for {}, no alternative"
                            + " left", credential.method(), repo);
                    job.fail(JobError.of(e));
                    return null;
                }
                LOG.info("Credential {} rejected for {}, falling back to {}",
                        credential.method(), repo, alternative.get().method());
                job.retryScheduled(JobError.of(e));
                job.resumeResolving();
                credential = alternative.get();
                tried.add(credential.method());
                credentialSwitched = true;

            } catch (final CorruptWorkspaceException e) {
                if (recloneForced) {
                    LOG.warn("Forced re-clone of {} failed: {}",
                            repo, e.getMessage());
                    job.fail(JobError.of(e));
                    return null;
                }
                LOG.warn("Workspace of {} is corrupt, forcing a re-clone: {}",
                        repo, e.getMessage());
                job.retryScheduled(JobError.of(e));
                recloneForced = true;
            }
        }
    }

    private SyncResult syncWithPermit(final Job job,
            final CredentialHandle credential, final boolean forceReclone,
            final CancellationToken cancellation) throws InterruptedException {

        while (!syncPermits.tryAcquire(PERMIT_POLL_MILLIS,
                TimeUnit.MILLISECONDS)) {
            if (cancellation.isCancelled()) {
                throw new SyncCancelledException("Cancelled while waiting"
                        + " for a sync slot for " + job.repository(), null);
            }
        }
        try {
            return syncEngine.sync(new SyncRequest(job.repository(),
                    credential, job.watermark(), forceReclone, cancellation));
        } finally {
            syncPermits.release();
        }
    }

    private void handOff(final RepositoryRef repo, final SyncResult result) {
        if (result.isNoOp()) {
            LOG.debug("Nothing changed in {}, skipping re-analysis", repo);
            return;
        }
        try {
            reanalysisTrigger.trigger(new ReanalysisRequest(repo,
                    result.after(), result.changedPaths(), result.isFull()));
        } catch (final RuntimeException e) {
            LOG.warn("Re-analysis handoff for {} failed: {}",
                    repo, e.getMessage(), e);
        }
    }

    private void checkpoint(final Job job) {
        try {
            jobRepository.save(job);
        } catch (final RuntimeException e) {
            LOG.warn("Failed to persist job for {}: {}",
                    job.repository(), e.getMessage(), e);
        }
    }

    /**
     * Returns the number of sync permits currently free.
     *
     * @return the free permits
     */
    public int availableSyncPermits() {
        return syncPermits.availablePermits();
    }

}
