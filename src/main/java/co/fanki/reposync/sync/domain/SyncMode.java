package co.fanki.reposync.sync.domain;

/**
 * How a sync pass brought the checkout up to date.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SyncMode {

    /** Remote tip equals the watermark; nothing was touched. */
    NO_CHANGE,

    /** Fetched and fast-forwarded; changed paths come from a tree diff. */
    INCREMENTAL,

    /** First materialization of the repository. */
    INITIAL_CLONE,

    /** Checkout replaced by a fresh clone (diverged history or recovery). */
    RECLONE;

    /**
     * Checks whether downstream consumers must treat every file as changed.
     *
     * @return true for clones
     */
    public boolean isFull() {
        return this == INITIAL_CLONE || this == RECLONE;
    }

}
