package co.fanki.reposync.job.domain;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.Preconditions;
import co.fanki.reposync.sync.domain.SyncResult;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate root tracking one repository through its sync passes.
 *
 * <p>A job is bound to a single repository for life and is reused
 * across passes: a pass starts in {@link JobState#PENDING} and ends in
 * {@link JobState#REPORTED} or {@link JobState#FAILED}, and the next
 * trigger re-arms it. Every state change goes through
 * {@link JobStateMachine}.</p>
 *
 * <p>Only the worker running the current pass mutates a job; mutators
 * and {@link #snapshot()} are synchronized so that inspection from other
 * threads sees a consistent view.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Job {

    /** Number of sync results kept in the history. */
    public static final int HISTORY_LIMIT = 10;

    private final String id;
    private final RepositoryRef repository;
    private CredentialMethod accessHint;
    private JobState state;
    private int attempt;
    private JobError lastError;
    private Watermark watermark;
    private final Deque<SyncResult> history;
    private CredentialMethod lastCredentialMethod;
    private JobState lastKnownState;
    private final Instant createdAt;
    private Instant updatedAt;
    private final Clock clock;

    private Job(
            final String theId,
            final RepositoryRef theRepository,
            final CredentialMethod theAccessHint,
            final Instant theCreatedAt,
            final Clock theClock) {
        this.id = Preconditions.requireNonBlank(theId, "Job ID is required");
        this.repository = Preconditions.requireNonNull(theRepository,
                "Repository is required");
        this.accessHint = theAccessHint;
        this.state = JobState.PENDING;
        this.history = new ArrayDeque<>();
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
        this.createdAt = theCreatedAt != null ? theCreatedAt : clock.instant();
        this.updatedAt = this.createdAt;
    }

    /**
     * Creates a new job for a repository.
     *
     * @param repository the repository
     * @param accessHint the credential method discovery suggested, may
     *        be null
     * @return a new pending job
     */
    public static Job create(final RepositoryRef repository,
            final CredentialMethod accessHint) {
        return create(repository, accessHint, Clock.systemUTC());
    }

    /**
     * Creates a new job whose timestamps follow the given clock.
     *
     * @param repository the repository
     * @param accessHint the credential method discovery suggested, may
     *        be null
     * @param clock stamps creation and every state change
     * @return a new pending job
     */
    public static Job create(final RepositoryRef repository,
            final CredentialMethod accessHint, final Clock clock) {
        return new Job(UUID.randomUUID().toString(), repository, accessHint,
                null, clock);
    }

    /**
     * Reconstitutes a job from persistence.
     *
     * @param id the job ID
     * @param repository the repository
     * @param accessHint the access hint, may be null
     * @param state the stored state
     * @param attempt the attempt counter of the last pass
     * @param lastError the last error, may be null
     * @param watermark the current watermark, may be null
     * @param history the stored sync results, oldest first
     * @param lastCredentialMethod the last credential used, may be null
     * @param lastKnownState the state before the last interruption, may
     *        be null
     * @param createdAt when created
     * @param updatedAt when last updated
     * @return the reconstituted job
     */
    public static Job reconstitute(
            final String id,
            final RepositoryRef repository,
            final CredentialMethod accessHint,
            final JobState state,
            final int attempt,
            final JobError lastError,
            final Watermark watermark,
            final List<SyncResult> history,
            final CredentialMethod lastCredentialMethod,
            final JobState lastKnownState,
            final Instant createdAt,
            final Instant updatedAt) {
        return reconstitute(id, repository, accessHint, state, attempt,
                lastError, watermark, history, lastCredentialMethod,
                lastKnownState, createdAt, updatedAt, Clock.systemUTC());
    }

    /**
     * Reconstitutes a job whose later state changes are stamped by the
     * given clock. The other parameters are those of the variant without
     * a clock.
     *
     * @param clock stamps every later state change
     * @return the reconstituted job
     */
    public static Job reconstitute(
            final String id,
            final RepositoryRef repository,
            final CredentialMethod accessHint,
            final JobState state,
            final int attempt,
            final JobError lastError,
            final Watermark watermark,
            final List<SyncResult> history,
            final CredentialMethod lastCredentialMethod,
            final JobState lastKnownState,
            final Instant createdAt,
            final Instant updatedAt,
            final Clock clock) {

        final Job job = new Job(id, repository, accessHint, createdAt, clock);
        job.state = Preconditions.requireNonNull(state, "State is required");
        job.attempt = attempt;
        job.lastError = lastError;
        job.watermark = watermark;
        if (history != null) {
            history.forEach(job::remember);
        }
        job.lastCredentialMethod = lastCredentialMethod;
        job.lastKnownState = lastKnownState;
        job.updatedAt = updatedAt != null ? updatedAt : job.createdAt;
        return job;
    }

    /**
     * Re-arms a finished job for a new pass.
     *
     * <p>Clears the per-pass data: attempt counter, last error and last
     * known state. A job that is already pending is left as is.</p>
     */
    public synchronized void rearm() {
        if (state.isTerminal()) {
            moveTo(JobState.PENDING);
        }
        if (state != JobState.PENDING) {
            throw new IllegalStateException("Job for " + repository
                    + " is in flight: " + state);
        }
        attempt = 0;
        lastError = null;
        lastKnownState = null;
        touch();
    }

    /** Starts the pass by moving on to credential resolution. */
    public synchronized void dispatch() {
        moveTo(JobState.RESOLVING_CREDENTIAL);
    }

    /**
     * Records the credential that will be used and starts an attempt.
     *
     * @param method the resolved credential method
     */
    public synchronized void startSyncAttempt(final CredentialMethod method) {
        Preconditions.requireNonNull(method, "Credential method is required");
        moveTo(JobState.SYNCING);
        lastCredentialMethod = method;
        attempt++;
    }

    /**
     * Records a successful sync and advances the watermark.
     *
     * @param result the sync result
     */
    public synchronized void syncSucceeded(final SyncResult result) {
        Preconditions.requireNonNull(result, "Sync result is required");
        moveTo(JobState.AWAITING_REANALYSIS_ACK);
        watermark = result.after();
        lastError = null;
        remember(result);
    }

    /**
     * Records a retryable failure.
     *
     * @param error the failure
     */
    public synchronized void retryScheduled(final JobError error) {
        Preconditions.requireNonNull(error, "Error is required");
        moveTo(JobState.RETRY_SCHEDULED);
        lastError = error;
    }

    /** Goes back to credential resolution after an auth rejection. */
    public synchronized void resumeResolving() {
        moveTo(JobState.RESOLVING_CREDENTIAL);
    }

    /**
     * Ends the pass with an error.
     *
     * @param error the failure
     */
    public synchronized void fail(final JobError error) {
        Preconditions.requireNonNull(error, "Error is required");
        moveTo(JobState.FAILED);
        lastError = error;
    }

    /** Ends the pass after the re-analysis handoff. */
    public synchronized void reanalysisHandedOff() {
        moveTo(JobState.REPORTED);
    }

    /**
     * Ends the pass because of a forced shutdown.
     *
     * <p>The current state is kept as the last known state, so the report
     * tells where the pass was cut off.</p>
     */
    public synchronized void interrupt() {
        lastKnownState = state;
        moveTo(JobState.REPORTED);
        lastError = new JobError(ErrorKind.CANCELLED,
                "Pass interrupted by shutdown in state " + lastKnownState);
    }

    /**
     * Brings back a job that was persisted mid-pass by a process that
     * stopped without reporting.
     *
     * @return true if the job was in flight and has been reset
     */
    public synchronized boolean resetAfterRestart() {
        if (!state.isInFlight()) {
            return false;
        }
        lastKnownState = state;
        state = JobState.PENDING;
        touch();
        return true;
    }

    /**
     * Returns the credential candidates for this job.
     *
     * @return the default preference with the access hint first
     */
    public List<CredentialMethod> credentialCandidates() {
        return CredentialMethod.preferenceWith(accessHint());
    }

    /**
     * Replaces the access hint given by discovery.
     *
     * @param theAccessHint the new hint, may be null
     */
    public synchronized void updateAccessHint(
            final CredentialMethod theAccessHint) {
        this.accessHint = theAccessHint;
        touch();
    }

    /**
     * Returns a consistent, immutable view of the job.
     *
     * @return the snapshot
     */
    public synchronized JobSnapshot snapshot() {
        final SyncResult last = history.peekLast();
        return new JobSnapshot(
                id,
                repository.identifier(),
                state,
                attempt,
                lastError,
                watermark != null ? watermark.commitId() : null,
                watermark != null ? watermark.syncedAt() : null,
                lastCredentialMethod,
                last != null ? last.changedPathCount() : null,
                last != null ? last.mode() : null,
                lastKnownState,
                updatedAt);
    }

    private void remember(final SyncResult result) {
        history.addLast(result);
        while (history.size() > HISTORY_LIMIT) {
            history.removeFirst();
        }
    }

    private void moveTo(final JobState target) {
        state = JobStateMachine.transition(state, target);
        touch();
    }

    private void touch() {
        updatedAt = clock.instant();
    }

    public String id() {
        return id;
    }

    public RepositoryRef repository() {
        return repository;
    }

    public synchronized CredentialMethod accessHint() {
        return accessHint;
    }

    public synchronized JobState state() {
        return state;
    }

    public synchronized int attempt() {
        return attempt;
    }

    public synchronized JobError lastError() {
        return lastError;
    }

    public synchronized Watermark watermark() {
        return watermark;
    }

    /**
     * Returns the recent sync results, oldest first.
     *
     * @return a copy of the history
     */
    public synchronized List<SyncResult> history() {
        return List.copyOf(new ArrayList<>(history));
    }

    public synchronized CredentialMethod lastCredentialMethod() {
        return lastCredentialMethod;
    }

    public synchronized JobState lastKnownState() {
        return lastKnownState;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

}
