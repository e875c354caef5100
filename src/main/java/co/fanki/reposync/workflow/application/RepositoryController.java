package co.fanki.reposync.workflow.application;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.repository.domain.Protocol;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.workflow.application.WorkflowCoordinator.EnqueueOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for repository discovery.
 *
 * <p>Whatever finds a repository (an accepted invitation, an operator,
 * a script) posts it here and the orchestrator takes it from there.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/repositories")
@Tag(name = "Discovery", description = "Register repositories for cloning and syncing")
public class RepositoryController {

    private static final Logger LOG = LoggerFactory.getLogger(
            RepositoryController.class);

    private final WorkflowCoordinator coordinator;

    /**
     * Creates a new RepositoryController.
     *
     * @param theCoordinator the workflow coordinator
     */
    public RepositoryController(final WorkflowCoordinator theCoordinator) {
        this.coordinator = theCoordinator;
    }

    /**
     * Registers a repository and enqueues a sync pass for it.
     *
     * @param request the repository, by URL or by host, owner and name
     * @return what the enqueue resulted in
     */
    @Operation(
            summary = "Register a repository",
            description = "Creates the repository's job if needed and enqueues a sync pass. "
                    + "Registering a repository that is already queued is a no-op."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Pass enqueued",
                    content = @Content(schema = @Schema(
                            implementation = EnqueueResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid repository"),
            @ApiResponse(responseCode = "503", description = "Shutting down")
    })
    @PostMapping
    public ResponseEntity<EnqueueResponse> register(
            @RequestBody final RegisterRepositoryRequest request) {

        final RepositoryRef repo = request.toRepositoryRef();
        LOG.info("Discovery request for {} (hint: {})", repo,
                request.accessHint());

        final EnqueueOutcome outcome = coordinator.enqueue(repo,
                request.accessHint());
        final HttpStatus status = outcome == EnqueueOutcome.REJECTED
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status)
                .body(new EnqueueResponse(repo.identifier(), outcome));
    }

    /**
     * Request to register a repository.
     *
     * @param url a clone URL; when present the other location fields
     *     are ignored
     * @param host the git host (optional, defaults to github.com)
     * @param owner the owning user or organization
     * @param name the repository name
     * @param protocol the preferred protocol (optional, defaults to HTTPS)
     * @param accessHint the credential method to try first (optional)
     */
    public record RegisterRepositoryRequest(
            String url,
            String host,
            String owner,
            String name,
            Protocol protocol,
            CredentialMethod accessHint
    ) {

        RepositoryRef toRepositoryRef() {
            if (url != null && !url.isBlank()) {
                return RepositoryRef.parse(url);
            }
            return RepositoryRef.of(
                    host != null && !host.isBlank()
                            ? host : RepositoryRef.DEFAULT_HOST,
                    owner,
                    name,
                    protocol != null ? protocol : Protocol.HTTPS);
        }
    }

    /**
     * Response to a registration.
     *
     * @param repository the canonical repository identifier
     * @param outcome what the enqueue resulted in
     */
    public record EnqueueResponse(
            String repository,
            EnqueueOutcome outcome
    ) {}

}
