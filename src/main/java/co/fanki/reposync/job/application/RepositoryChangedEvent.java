package co.fanki.reposync.job.application;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;

import java.util.List;

/**
 * Application event published after a sync changed a checkout.
 *
 * <p>Listeners re-analyze {@code changedPaths}, or the whole repository
 * when {@code full} is set. The checkout must be read under
 * {@link co.fanki.reposync.repository.domain.WorkspaceLocks#readLock}.</p>
 *
 * @param repository the repository
 * @param watermark the commit the checkout is at
 * @param changedPaths the paths that changed
 * @param full true when the checkout was (re-)cloned
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RepositoryChangedEvent(
        RepositoryRef repository,
        Watermark watermark,
        List<String> changedPaths,
        boolean full
) {
}
