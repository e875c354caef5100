package co.fanki.reposync.sync.domain;

import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.Preconditions;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Outcome of one successful sync.
 *
 * <p>Changed paths are sorted and free of duplicates. For full clones
 * they list every file of the new tip, so consumers can treat them as
 * "analyze everything".</p>
 *
 * @param before the watermark the sync started from, null if none
 * @param after the watermark the checkout is at now
 * @param changedPaths repository relative paths that differ
 * @param mode how the checkout was updated
 * @param duration wall time of the sync
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyncResult(
        Watermark before,
        Watermark after,
        List<String> changedPaths,
        SyncMode mode,
        Duration duration
) {

    /** Validates and normalizes the components. */
    public SyncResult {
        Preconditions.requireNonNull(after, "Resulting watermark is required");
        Preconditions.requireNonNull(mode, "Sync mode is required");
        Preconditions.requireNonNull(duration, "Duration is required");
        changedPaths = changedPaths == null
                ? List.of()
                : List.copyOf(new TreeSet<>(changedPaths));
    }

    /**
     * Result of a pass that found the remote at the known watermark.
     *
     * @param watermark the unchanged watermark
     * @param duration wall time of the check
     * @return a result with no changed paths
     */
    public static SyncResult noChange(final Watermark watermark,
            final Duration duration) {
        return new SyncResult(watermark, watermark, List.of(),
                SyncMode.NO_CHANGE, duration);
    }

    /**
     * Result of a fetch and fast-forward.
     *
     * @param before the previous watermark
     * @param after the new watermark
     * @param changedPaths paths differing between both commits
     * @param duration wall time of the sync
     * @return the result
     */
    public static SyncResult incremental(final Watermark before,
            final Watermark after, final Collection<String> changedPaths,
            final Duration duration) {
        return new SyncResult(before, after, List.copyOf(changedPaths),
                SyncMode.INCREMENTAL, duration);
    }

    /**
     * Result of a clone.
     *
     * @param before the previous watermark, null on first population
     * @param after the new watermark
     * @param allPaths every file of the cloned tip
     * @param mode {@link SyncMode#INITIAL_CLONE} or {@link SyncMode#RECLONE}
     * @param duration wall time of the sync
     * @return the result
     */
    public static SyncResult full(final Watermark before,
            final Watermark after, final Collection<String> allPaths,
            final SyncMode mode, final Duration duration) {
        Preconditions.require(mode.isFull(), "Not a full sync mode: " + mode);
        return new SyncResult(before, after, List.copyOf(allPaths), mode,
                duration);
    }

    /**
     * Checks whether every file must be considered changed.
     *
     * @return true for clones
     */
    public boolean isFull() {
        return mode.isFull();
    }

    /**
     * Checks whether the pass left the checkout untouched.
     *
     * @return true when nothing changed
     */
    public boolean isNoOp() {
        return mode == SyncMode.NO_CHANGE;
    }

    /**
     * Returns the number of changed paths.
     *
     * @return the count
     */
    public int changedPathCount() {
        return changedPaths.size();
    }

}
