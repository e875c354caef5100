package co.fanki.reposync.repository.domain;

import co.fanki.reposync.shared.Preconditions;
import co.fanki.reposync.shared.ValueObject;

import java.time.Instant;

/**
 * Last commit a workspace was synchronized to, and when.
 *
 * @param commitId the full commit hash
 * @param syncedAt when the workspace reached that commit
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Watermark(String commitId, Instant syncedAt)
        implements ValueObject {

    /** Validates the components. */
    public Watermark {
        Preconditions.requireNonBlank(commitId, "Commit id is required");
        Preconditions.requireNonNull(syncedAt, "Sync time is required");
    }

    /**
     * Creates a watermark stamped at the given instant.
     *
     * @param commitId the commit hash
     * @param syncedAt the sync time
     * @return the watermark
     */
    public static Watermark at(final String commitId, final Instant syncedAt) {
        return new Watermark(commitId, syncedAt);
    }

    /**
     * Checks whether this watermark points at the given commit.
     *
     * @param otherCommitId the commit hash to compare, may be null
     * @return true if both hashes are equal
     */
    public boolean isAt(final String otherCommitId) {
        return commitId.equals(otherCommitId);
    }

}
