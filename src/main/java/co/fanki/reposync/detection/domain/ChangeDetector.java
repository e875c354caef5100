package co.fanki.reposync.detection.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;

/**
 * Decides whether a repository is due for a sync pass.
 *
 * <p>Implementations are safe to call while a pass for the same
 * repository is running; the coordinator turns the answer into a
 * "sync again after this pass" request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ChangeDetector {

    /**
     * Checks whether the repository changed since its last sync.
     *
     * @param repo the repository
     * @return true if a pass should be enqueued
     */
    boolean shouldSync(RepositoryRef repo);

}
