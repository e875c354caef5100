package co.fanki.reposync.job.domain;

/**
 * Lifecycle states of a repository job.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum JobState {

    /** Waiting for a trigger. */
    PENDING,

    /** Looking up a usable credential. */
    RESOLVING_CREDENTIAL,

    /** Cloning or fetching. */
    SYNCING,

    /** Sleeping before the next sync attempt. */
    RETRY_SCHEDULED,

    /** Sync done, handing changed paths to re-analysis. */
    AWAITING_REANALYSIS_ACK,

    /** Pass finished and reported. */
    REPORTED,

    /** Pass ended with an error. */
    FAILED;

    /**
     * Checks whether a pass ended in this state.
     *
     * @return true for {@link #REPORTED} and {@link #FAILED}
     */
    public boolean isTerminal() {
        return this == REPORTED || this == FAILED;
    }

    /**
     * Checks whether a pass is running in this state.
     *
     * @return true for every state between dispatch and report
     */
    public boolean isInFlight() {
        return this != PENDING && !isTerminal();
    }

}
