package co.fanki.reposync.sync.domain;

/**
 * Materializes or updates the working copy of a repository.
 *
 * <p>Implementations never leave a half-written checkout behind: a
 * failed or cancelled sync leaves the workspace as it was before.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface SyncEngine {

    /**
     * Brings the checkout of a repository up to the remote tip.
     *
     * @param request what to sync and how
     * @return the outcome
     * @throws AuthException if the remote rejects the credential
     * @throws NetworkException on transient transport failures
     * @throws CorruptWorkspaceException if the local checkout is unusable
     * @throws SyncCancelledException if the cancellation signal fired
     */
    SyncResult sync(SyncRequest request);

}
