package co.fanki.reposync.workflow.application;

import co.fanki.reposync.job.domain.JobSnapshot;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for job inspection.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Inspect per-repository job state")
public class JobController {

    private final WorkflowCoordinator coordinator;

    /**
     * Creates a new JobController.
     *
     * @param theCoordinator the workflow coordinator
     */
    public JobController(final WorkflowCoordinator theCoordinator) {
        this.coordinator = theCoordinator;
    }

    /**
     * Lists every known job.
     *
     * @return the job snapshots
     */
    @Operation(summary = "List jobs")
    @GetMapping
    public ResponseEntity<JobListResponse> listJobs() {
        return ResponseEntity.ok(new JobListResponse(coordinator.jobs()));
    }

    /**
     * Returns the job of one repository.
     *
     * @param host the git host
     * @param owner the repository owner
     * @param name the repository name
     * @return the job snapshot
     */
    @Operation(summary = "Get the job of a repository")
    @GetMapping("/{host}/{owner}/{name}")
    public ResponseEntity<JobSnapshot> getJob(
            @Parameter(description = "Git host", example = "github.com")
            @PathVariable("host") final String host,
            @Parameter(description = "Repository owner", example = "acme")
            @PathVariable("owner") final String owner,
            @Parameter(description = "Repository name", example = "widgets")
            @PathVariable("name") final String name) {

        final RepositoryRef repo = RepositoryRef.of(host, owner, name);
        return coordinator.job(repo)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new DomainException(
                        "No job for " + repo, "JOB_NOT_FOUND"));
    }

    /**
     * Response containing the list of jobs.
     */
    public record JobListResponse(
            List<JobSnapshot> jobs
    ) {}

}
