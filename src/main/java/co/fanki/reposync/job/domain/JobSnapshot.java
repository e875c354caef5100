package co.fanki.reposync.job.domain;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.sync.domain.SyncMode;

import java.time.Instant;

/**
 * Read-only view of a job for inspection.
 *
 * @param id the job ID
 * @param repository the repository identifier
 * @param state the current state
 * @param attempt sync attempts of the current or last pass
 * @param lastError the last failure, null if none
 * @param watermarkCommit the commit the checkout is at, null if never
 *        synced
 * @param watermarkSyncedAt when the checkout reached it
 * @param lastCredentialMethod the credential tag used last
 * @param lastChangedPathCount changed paths of the last sync
 * @param lastSyncMode how the last sync updated the checkout
 * @param lastKnownState the state an interrupted pass was cut off in
 * @param updatedAt when the job last changed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record JobSnapshot(
        String id,
        String repository,
        JobState state,
        int attempt,
        JobError lastError,
        String watermarkCommit,
        Instant watermarkSyncedAt,
        CredentialMethod lastCredentialMethod,
        Integer lastChangedPathCount,
        SyncMode lastSyncMode,
        JobState lastKnownState,
        Instant updatedAt
) {
}
