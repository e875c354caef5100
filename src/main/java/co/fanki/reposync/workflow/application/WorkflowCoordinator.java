package co.fanki.reposync.workflow.application;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.job.application.JobRunner;
import co.fanki.reposync.job.domain.Job;
import co.fanki.reposync.job.domain.JobRepository;
import co.fanki.reposync.job.domain.JobSnapshot;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.Preconditions;
import co.fanki.reposync.sync.domain.CancellationToken;
import co.fanki.reposync.workflow.domain.WorkflowReport;
import co.fanki.reposync.workflow.domain.WorkflowReportLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Owns the live jobs and dispatches their passes onto the worker pool.
 *
 * <p>Each repository has exactly one job, created on first enqueue or
 * loaded from the job store. A repository is either idle, scheduled or
 * running. Enqueueing a scheduled repository is a no-op; enqueueing a
 * running one sets a single "sync again" flag that re-schedules it when
 * the current pass ends. Passes of one repository therefore never
 * overlap.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class WorkflowCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(
            WorkflowCoordinator.class);

    /** What an enqueue request resulted in. */
    public enum EnqueueOutcome {

        /** A pass was submitted to the worker pool. */
        SCHEDULED,

        /** A pass was already waiting; nothing changed. */
        ALREADY_PENDING,

        /** A pass is running; another one follows it. */
        QUEUED_AFTER_CURRENT,

        /** The coordinator is shutting down. */
        REJECTED
    }

    private final JobRepository jobRepository;
    private final JobRunner jobRunner;
    private final WorkflowReportLog reportLog;
    private final ExecutorService workers;
    private final Duration shutdownGrace;
    private final Clock clock;

    private final CancellationToken cancellation = new CancellationToken();
    private final ConcurrentMap<RepositoryRef, JobSlot> slots =
            new ConcurrentHashMap<>();
    private final Object idleMonitor = new Object();
    private int activeSlots;
    private volatile boolean shuttingDown;

    /**
     * Creates a new WorkflowCoordinator.
     *
     * @param theJobRepository loads and stores jobs
     * @param theJobRunner runs passes
     * @param theReportLog the report sink
     * @param theWorkers the worker pool, owned by the coordinator
     * @param theShutdownGrace how long shutdown waits for passes to
     *        report before interrupting the workers
     * @param theClock stamps the jobs the coordinator creates
     */
    public WorkflowCoordinator(
            final JobRepository theJobRepository,
            final JobRunner theJobRunner,
            final WorkflowReportLog theReportLog,
            final ExecutorService theWorkers,
            final Duration theShutdownGrace,
            final Clock theClock) {
        this.jobRepository = Preconditions.requireNonNull(theJobRepository,
                "Job repository is required");
        this.jobRunner = Preconditions.requireNonNull(theJobRunner,
                "Job runner is required");
        this.reportLog = Preconditions.requireNonNull(theReportLog,
                "Report log is required");
        this.workers = Preconditions.requireNonNull(theWorkers,
                "Worker pool is required");
        this.shutdownGrace = Preconditions.requirePositive(theShutdownGrace,
                "Shutdown grace period must be positive");
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
    }

    /**
     * Loads the stored jobs and re-schedules those a previous process left
     * mid-pass.
     *
     * @return how many jobs were re-scheduled
     */
    public int restore() {
        int resumed = 0;
        for (final Job job : jobRepository.findAll()) {
            final boolean interrupted = job.resetAfterRestart();
            if (interrupted) {
                LOG.info("Job for {} was interrupted in {}, resuming",
                        job.repository(), job.lastKnownState());
                jobRepository.save(job);
            }
            slots.putIfAbsent(job.repository(), new JobSlot(job));
            if (interrupted
                    && enqueue(job.repository()) == EnqueueOutcome.SCHEDULED) {
                resumed++;
            }
        }
        LOG.info("Restored {} job(s), {} resumed", slots.size(), resumed);
        return resumed;
    }

    /**
     * Requests a sync pass for a repository.
     *
     * @param repo the repository
     * @return the outcome
     */
    public EnqueueOutcome enqueue(final RepositoryRef repo) {
        return enqueue(repo, null);
    }

    /**
     * Requests a sync pass for a repository found by discovery.
     *
     * @param repo the repository
     * @param accessHint the credential method discovery suggests, may be
     *        null to keep the current one
     * @return the outcome
     */
    public EnqueueOutcome enqueue(final RepositoryRef repo,
            final CredentialMethod accessHint) {
        Preconditions.requireNonNull(repo, "Repository is required");
        if (shuttingDown) {
            LOG.debug("Shutting down, rejecting enqueue of {}", repo);
            return EnqueueOutcome.REJECTED;
        }

        final JobSlot slot = slots.computeIfAbsent(repo,
                key -> new JobSlot(loadOrCreate(key, accessHint)));

        if (accessHint != null
                && !Objects.equals(accessHint, slot.job.accessHint())) {
            slot.job.updateAccessHint(accessHint);
        }

        synchronized (slot) {
            if (slot.running) {
                if (slot.rerun) {
                    return EnqueueOutcome.ALREADY_PENDING;
                }
                slot.rerun = true;
                LOG.debug("{} is running, another pass follows", repo);
                return EnqueueOutcome.QUEUED_AFTER_CURRENT;
            }
            if (slot.scheduled) {
                return EnqueueOutcome.ALREADY_PENDING;
            }
            slot.scheduled = true;
        }

        if (!submit(slot)) {
            return EnqueueOutcome.REJECTED;
        }
        LOG.info("Scheduled pass for {}", repo);
        return EnqueueOutcome.SCHEDULED;
    }

    /**
     * Streams the reports created at or after an instant, oldest first.
     *
     * @param since the lower bound, inclusive
     * @return a new stream; callers must close it
     */
    public Stream<WorkflowReport> reportsSince(final Instant since) {
        Preconditions.requireNonNull(since, "Since is required");
        return reportLog.since(since);
    }

    /**
     * Returns a snapshot of every known job.
     *
     * @return the snapshots, ordered by repository
     */
    public List<JobSnapshot> jobs() {
        return slots.values().stream()
                .map(slot -> slot.job.snapshot())
                .sorted(Comparator.comparing(JobSnapshot::repository))
                .toList();
    }

    /**
     * Returns a snapshot of one job.
     *
     * @param repo the repository
     * @return the snapshot, or empty if the repository is unknown
     */
    public Optional<JobSnapshot> job(final RepositoryRef repo) {
        final JobSlot slot = slots.get(repo);
        if (slot != null) {
            return Optional.of(slot.job.snapshot());
        }
        return jobRepository.findByRepository(repo).map(Job::snapshot);
    }

    /**
     * Returns the repositories the coordinator has a job for.
     *
     * @return a snapshot of the repositories
     */
    public Set<RepositoryRef> knownRepositories() {
        return Set.copyOf(slots.keySet());
    }

    /**
     * Returns the number of repositories scheduled or running.
     *
     * @return the active count
     */
    public int activePasses() {
        synchronized (idleMonitor) {
            return activeSlots;
        }
    }

    /**
     * Waits until no pass is scheduled or running.
     *
     * @param timeout the maximum time to wait
     * @return true if idle, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(final Duration timeout)
            throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (activeSlots > 0) {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
            return true;
        }
    }

    /**
     * Stops accepting work and aborts running passes.
     *
     * <p>Running transfers are cancelled and queued passes report
     * without syncing, so every scheduled pass still yields a report.
     * Workers that do not finish within the grace period are
     * interrupted.</p>
     */
    public void shutdown() {
        if (shuttingDown) {
            return;
        }
        LOG.info("Shutting down workflow coordinator ({} active pass(es))",
                activePasses());
        shuttingDown = true;
        cancellation.cancel();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownGrace.toMillis(),
                    TimeUnit.MILLISECONDS)) {
                LOG.warn("Workers did not stop within {}, interrupting",
                        shutdownGrace);
                workers.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private Job loadOrCreate(final RepositoryRef repo,
            final CredentialMethod accessHint) {
        final Optional<Job> stored = jobRepository.findByRepository(repo);
        if (stored.isPresent()) {
            final Job job = stored.get();
            if (job.resetAfterRestart()) {
                LOG.info("Job for {} was interrupted in {}, resetting",
                        repo, job.lastKnownState());
                jobRepository.save(job);
            }
            return job;
        }
        final Job job = Job.create(repo, accessHint, clock);
        jobRepository.save(job);
        LOG.info("Created job {} for {}", job.id(), repo);
        return job;
    }

    private boolean submit(final JobSlot slot) {
        synchronized (idleMonitor) {
            activeSlots++;
        }
        try {
            workers.execute(() -> runSlot(slot));
            return true;
        } catch (final RejectedExecutionException e) {
            LOG.warn("Worker pool rejected pass for {}: {}",
                    slot.job.repository(), e.getMessage());
            synchronized (slot) {
                slot.scheduled = false;
            }
            deactivated();
            return false;
        }
    }

    private void runSlot(final JobSlot slot) {
        synchronized (slot) {
            slot.running = true;
        }
        boolean again = false;
        try {
            jobRunner.runPass(slot.job, cancellation);
        } catch (final RuntimeException e) {
            LOG.error("Pass for {} escaped the runner: {}",
                    slot.job.repository(), e.getMessage(), e);
        } finally {
            synchronized (slot) {
                slot.running = false;
                again = slot.rerun && !shuttingDown;
                slot.rerun = false;
                slot.scheduled = again;
            }
            if (again) {
                LOG.debug("Re-running {} for a change seen mid-pass",
                        slot.job.repository());
                submit(slot);
            }
            deactivated();
        }
    }

    private void deactivated() {
        synchronized (idleMonitor) {
            activeSlots--;
            if (activeSlots == 0) {
                idleMonitor.notifyAll();
            }
        }
    }

    /** Scheduling state of one repository. Guarded by the slot itself. */
    private static final class JobSlot {

        private final Job job;
        private boolean scheduled;
        private boolean running;
        private boolean rerun;

        private JobSlot(final Job theJob) {
            this.job = theJob;
        }
    }

}
