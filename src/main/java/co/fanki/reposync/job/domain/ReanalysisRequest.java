package co.fanki.reposync.job.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.Preconditions;

import java.util.List;

/**
 * What downstream analysis needs to know about a synced repository.
 *
 * @param repository the repository
 * @param watermark the commit the checkout is at now
 * @param changedPaths paths to re-analyze; every file when {@code full}
 * @param full true when the checkout was (re-)cloned
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReanalysisRequest(
        RepositoryRef repository,
        Watermark watermark,
        List<String> changedPaths,
        boolean full
) {

    /** Validates the components. */
    public ReanalysisRequest {
        Preconditions.requireNonNull(repository, "Repository is required");
        Preconditions.requireNonNull(watermark, "Watermark is required");
        changedPaths = changedPaths == null ? List.of() : List.copyOf(changedPaths);
    }

}
