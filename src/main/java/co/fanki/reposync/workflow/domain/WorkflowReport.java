package co.fanki.reposync.workflow.domain;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.job.domain.Job;
import co.fanki.reposync.job.domain.JobError;
import co.fanki.reposync.job.domain.JobState;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.Preconditions;
import co.fanki.reposync.sync.domain.SyncResult;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit record of one job pass.
 *
 * <p>Carries the credential tag but never the credential itself.</p>
 *
 * @param id the report ID
 * @param repository the repository identifier, {@code host/owner/name}
 * @param state the state the pass ended in
 * @param lastKnownState the state an interrupted pass was cut off in,
 *        null otherwise
 * @param attempts sync attempts made in the pass
 * @param startedAt when the pass started
 * @param finishedAt when the pass ended
 * @param duration wall time of the pass
 * @param changedPathCount paths changed by the pass, 0 if none
 * @param fullSync true if the checkout was (re-)cloned
 * @param errorKind the failure classification, null on success
 * @param errorMessage the failure description, null on success
 * @param credentialMethod the credential tag used last, null if none
 * @param commitId the watermark commit after the pass, null if never
 *        synced
 * @param createdAt when the report was created
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record WorkflowReport(
        String id,
        String repository,
        JobState state,
        JobState lastKnownState,
        int attempts,
        Instant startedAt,
        Instant finishedAt,
        Duration duration,
        int changedPathCount,
        boolean fullSync,
        ErrorKind errorKind,
        String errorMessage,
        CredentialMethod credentialMethod,
        String commitId,
        Instant createdAt
) {

    /** Validates the components. */
    public WorkflowReport {
        Preconditions.requireNonBlank(id, "Report ID is required");
        Preconditions.requireNonBlank(repository, "Repository is required");
        Preconditions.requireNonNull(state, "Final state is required");
        Preconditions.requireNonNull(createdAt, "Creation time is required");
    }

    /**
     * Builds the report of a finished pass.
     *
     * @param job the job, in {@link JobState#REPORTED} or
     *        {@link JobState#FAILED}
     * @param result the successful sync of the pass, null if none
     * @param startedAt when the pass started
     * @param finishedAt when the pass ended
     * @return the report
     */
    public static WorkflowReport of(final Job job, final SyncResult result,
            final Instant startedAt, final Instant finishedAt) {
        Preconditions.require(job.state().isTerminal(),
                "Only finished passes are reported, job is " + job.state());
        final JobError error = job.lastError();
        final Watermark watermark = job.watermark();
        return new WorkflowReport(
                UUID.randomUUID().toString(),
                job.repository().identifier(),
                job.state(),
                job.lastKnownState(),
                job.attempt(),
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt),
                result != null ? result.changedPathCount() : 0,
                result != null && result.isFull(),
                error != null ? error.kind() : null,
                error != null ? error.message() : null,
                job.lastCredentialMethod(),
                watermark != null ? watermark.commitId() : null,
                finishedAt);
    }

    /**
     * Checks whether the pass ended without error.
     *
     * @return true if no error kind was recorded
     */
    public boolean succeeded() {
        return errorKind == null;
    }

}
