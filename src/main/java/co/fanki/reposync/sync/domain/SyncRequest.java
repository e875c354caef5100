package co.fanki.reposync.sync.domain;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.Preconditions;

/**
 * Input of one sync.
 *
 * @param repository the repository to sync
 * @param credential the credential to authenticate with
 * @param previousWatermark the last synced commit, null if never synced
 * @param forceReclone true to skip the incremental path
 * @param cancellation the shutdown signal to honour
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyncRequest(
        RepositoryRef repository,
        CredentialHandle credential,
        Watermark previousWatermark,
        boolean forceReclone,
        CancellationToken cancellation
) {

    /** Validates the components. */
    public SyncRequest {
        Preconditions.requireNonNull(repository, "Repository is required");
        Preconditions.requireNonNull(credential, "Credential is required");
        Preconditions.requireNonNull(cancellation, "Cancellation is required");
    }

}
