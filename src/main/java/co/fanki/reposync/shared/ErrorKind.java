package co.fanki.reposync.shared;

/**
 * Classification of the failures a sync pass can run into.
 *
 * <p>The kind decides how a job reacts: transient kinds are retried
 * inside the job, the others end the pass and are recorded in its
 * workflow report.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ErrorKind {

    /** No configured credential is usable for the repository. */
    NO_USABLE_CREDENTIAL(false),

    /** The remote rejected the credential at transport time. */
    AUTH(false),

    /** Connection, DNS or timeout failure while talking to the remote. */
    NETWORK(true),

    /** The local checkout is inconsistent and cannot be trusted. */
    CORRUPT_WORKSPACE(false),

    /** The pass was aborted by a shutdown signal. */
    CANCELLED(false),

    /** Anything else; ends the pass. */
    INTERNAL(false);

    private final boolean transientFailure;

    ErrorKind(final boolean isTransient) {
        this.transientFailure = isTransient;
    }

    /**
     * Checks whether failures of this kind are worth retrying with backoff.
     *
     * @return true for transient failures
     */
    public boolean isTransient() {
        return transientFailure;
    }

}
