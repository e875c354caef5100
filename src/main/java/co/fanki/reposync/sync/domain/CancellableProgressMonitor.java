package co.fanki.reposync.sync.domain;

import org.eclipse.jgit.lib.EmptyProgressMonitor;

/**
 * Progress monitor through which JGit polls the shutdown signal during
 * clones and fetches.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class CancellableProgressMonitor extends EmptyProgressMonitor {

    private final CancellationToken cancellation;

    CancellableProgressMonitor(final CancellationToken theCancellation) {
        this.cancellation = theCancellation;
    }

    @Override
    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

}
