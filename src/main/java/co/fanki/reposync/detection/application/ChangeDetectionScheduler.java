package co.fanki.reposync.detection.application;

import co.fanki.reposync.detection.domain.PollingChangeDetector;
import co.fanki.reposync.detection.domain.PushEventChangeDetector;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.workflow.application.WorkflowCoordinator;
import co.fanki.reposync.workflow.application.WorkflowCoordinator.EnqueueOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Scheduled component that asks the change detectors which repositories
 * are due and enqueues them.
 *
 * <p>Push events are checked first: a repository with a debounced push
 * is enqueued without polling the remote. The remaining known
 * repositories are polled when polling is enabled. Errors are caught per
 * repository so one failure does not block others.</p>
 *
 * <p>Enabled by default; turn it off with
 * {@code orchestrator.detection.enabled=false}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "orchestrator.detection.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class ChangeDetectionScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            ChangeDetectionScheduler.class);

    private final WorkflowCoordinator coordinator;
    private final PushEventChangeDetector pushDetector;
    private final PollingChangeDetector pollingDetector;
    private final boolean pollingEnabled;

    /**
     * Creates a new ChangeDetectionScheduler.
     *
     * @param theCoordinator the workflow coordinator
     * @param thePushDetector the push event detector
     * @param thePollingDetector the polling detector
     * @param isPollingEnabled whether remotes are polled
     */
    public ChangeDetectionScheduler(
            final WorkflowCoordinator theCoordinator,
            final PushEventChangeDetector thePushDetector,
            final PollingChangeDetector thePollingDetector,
            @Value("${orchestrator.detection.polling-enabled:true}")
            final boolean isPollingEnabled) {
        this.coordinator = theCoordinator;
        this.pushDetector = thePushDetector;
        this.pollingDetector = thePollingDetector;
        this.pollingEnabled = isPollingEnabled;
    }

    /**
     * Runs one detection pass over every known repository.
     *
     * @return how many repositories were enqueued
     */
    @Scheduled(
            fixedDelayString = "${orchestrator.detection.interval-ms:60000}",
            initialDelayString = "${orchestrator.detection.initial-delay-ms:10000}")
    public int detectChanges() {
        final Set<RepositoryRef> candidates = new HashSet<>(
                coordinator.knownRepositories());
        candidates.addAll(pushDetector.pendingRepositories());

        if (candidates.isEmpty()) {
            LOG.debug("No repositories to check for changes");
            return 0;
        }

        int enqueued = 0;
        for (final RepositoryRef repo : candidates) {
            try {
                if (isDue(repo)) {
                    final EnqueueOutcome outcome = coordinator.enqueue(repo);
                    LOG.info("Change detected for {}: {}", repo, outcome);
                    if (outcome != EnqueueOutcome.REJECTED) {
                        enqueued++;
                    }
                }
            } catch (final Exception e) {
                LOG.error("Unexpected error checking {} for changes: {}",
                        repo, e.getMessage(), e);
            }
        }

        LOG.debug("Detection pass complete: {} of {} repositories due",
                enqueued, candidates.size());
        return enqueued;
    }

    private boolean isDue(final RepositoryRef repo) {
        if (pushDetector.shouldSync(repo)) {
            return true;
        }
        return pollingEnabled && pollingDetector.shouldSync(repo);
    }

}
