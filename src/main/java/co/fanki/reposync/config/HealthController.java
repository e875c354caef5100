package co.fanki.reposync.config;

import co.fanki.reposync.workflow.application.WorkflowCoordinator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simple health check endpoint.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final WorkflowCoordinator coordinator;

    /**
     * Creates a new HealthController.
     *
     * @param theCoordinator the workflow coordinator
     */
    public HealthController(final WorkflowCoordinator theCoordinator) {
        this.coordinator = theCoordinator;
    }

    /**
     * Returns health status.
     *
     * @return "up" with the number of known and active repositories
     */
    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("up",
                coordinator.knownRepositories().size(),
                coordinator.activePasses());
    }

    /**
     * Health status.
     *
     * @param status always "up" when the service answers
     * @param repositories repositories with a job
     * @param activePasses repositories scheduled or running
     */
    public record HealthResponse(
            String status,
            int repositories,
            int activePasses
    ) {}

}
