package co.fanki.reposync.job.domain;

import co.fanki.reposync.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all valid job state transitions.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   PENDING                 → RESOLVING_CREDENTIAL, FAILED, REPORTED
 *   RESOLVING_CREDENTIAL    → SYNCING, FAILED, REPORTED
 *   SYNCING                 → AWAITING_REANALYSIS_ACK, RETRY_SCHEDULED, FAILED, REPORTED
 *   RETRY_SCHEDULED         → SYNCING, RESOLVING_CREDENTIAL, FAILED, REPORTED
 *   AWAITING_REANALYSIS_ACK → REPORTED, FAILED
 *   REPORTED                → PENDING
 *   FAILED                  → PENDING, REPORTED
 * </pre>
 *
 * <p>Every in-flight state reaches {@code REPORTED} directly, which is
 * the edge a forced shutdown takes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JobStateMachine {

    private static final Map<JobState, Set<JobState>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(JobState.class);
        TRANSITIONS.put(JobState.PENDING, EnumSet.of(
                JobState.RESOLVING_CREDENTIAL, JobState.FAILED,
                JobState.REPORTED));
        TRANSITIONS.put(JobState.RESOLVING_CREDENTIAL, EnumSet.of(
                JobState.SYNCING, JobState.FAILED, JobState.REPORTED));
        TRANSITIONS.put(JobState.SYNCING, EnumSet.of(
                JobState.AWAITING_REANALYSIS_ACK, JobState.RETRY_SCHEDULED,
                JobState.FAILED, JobState.REPORTED));
        TRANSITIONS.put(JobState.RETRY_SCHEDULED, EnumSet.of(
                JobState.SYNCING, JobState.RESOLVING_CREDENTIAL,
                JobState.FAILED, JobState.REPORTED));
        TRANSITIONS.put(JobState.AWAITING_REANALYSIS_ACK, EnumSet.of(
                JobState.REPORTED, JobState.FAILED));
        TRANSITIONS.put(JobState.REPORTED, EnumSet.of(JobState.PENDING));
        TRANSITIONS.put(JobState.FAILED, EnumSet.of(
                JobState.PENDING, JobState.REPORTED));
    }

    private JobStateMachine() {
    }

    /**
     * Validates a state transition and returns the target state if it is
     * permitted.
     *
     * @param from the current state
     * @param to the desired target state
     * @return {@code to} when the transition is valid
     * @throws DomainException with code {@code JOB_INVALID_TRANSITION}
     *         when the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static JobState transition(final JobState from, final JobState to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        if (!canTransition(from, to)) {
            throw new DomainException(
                    "Invalid transition: " + from + " → " + to,
                    "JOB_INVALID_TRANSITION");
        }
        return to;
    }

    /**
     * Checks whether an edge exists without throwing.
     *
     * @param from the current state
     * @param to the target state
     * @return true if the transition is permitted
     */
    public static boolean canTransition(final JobState from,
            final JobState to) {
        return TRANSITIONS.getOrDefault(from, EnumSet.noneOf(JobState.class))
                .contains(to);
    }

}
