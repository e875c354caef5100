package co.fanki.reposync.job.domain;

import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.OrchestrationException;
import co.fanki.reposync.shared.Preconditions;

/**
 * Last failure recorded on a job.
 *
 * @param kind the failure classification
 * @param message a human readable description, never containing secrets
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record JobError(ErrorKind kind, String message) {

    /** Validates the components. */
    public JobError {
        Preconditions.requireNonNull(kind, "Error kind is required");
    }

    /**
     * Creates the error from a classified exception.
     *
     * @param exception the failure
     * @return the error
     */
    public static JobError of(final OrchestrationException exception) {
        return new JobError(exception.kind(), exception.getMessage());
    }

}
