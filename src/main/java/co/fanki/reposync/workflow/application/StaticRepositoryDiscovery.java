package co.fanki.reposync.workflow.application;

import co.fanki.reposync.config.OrchestratorProperties;
import co.fanki.reposync.repository.domain.RepositoryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the coordinator once the application is ready.
 *
 * <p>Restores the stored jobs, then enqueues every repository listed
 * under {@code orchestrator.repositories}. An invalid entry is logged
 * and skipped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class StaticRepositoryDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(
            StaticRepositoryDiscovery.class);

    private final WorkflowCoordinator coordinator;
    private final OrchestratorProperties properties;

    /**
     * Creates a new StaticRepositoryDiscovery.
     *
     * @param theCoordinator the workflow coordinator
     * @param theProperties the orchestrator properties
     */
    public StaticRepositoryDiscovery(final WorkflowCoordinator theCoordinator,
            final OrchestratorProperties theProperties) {
        this.coordinator = theCoordinator;
        this.properties = theProperties;
    }

    /**
     * Restores jobs and enqueues the configured repositories.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        coordinator.restore();

        for (final OrchestratorProperties.RepositoryEntry entry
                : properties.getRepositories()) {
            try {
                final RepositoryRef repo = RepositoryRef.parse(entry.getUrl());
                LOG.info("Configured repository {}: {}", repo,
                        coordinator.enqueue(repo, entry.getAccessHint()));
            } catch (final IllegalArgumentException e) {
                LOG.warn("Skipping configured repository {}: {}",
                        entry.getUrl(), e.getMessage());
            }
        }
    }

}
