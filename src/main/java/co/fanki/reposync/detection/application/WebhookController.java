package co.fanki.reposync.detection.application;

import co.fanki.reposync.detection.domain.PushEvent;
import co.fanki.reposync.detection.domain.PushEventChangeDetector;
import co.fanki.reposync.repository.domain.RepositoryRef;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller receiving push notifications.
 *
 * <p>Events are only recorded here; the detection pass turns them into
 * sync passes once their debounce window has passed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/webhooks")
@Tag(name = "Webhooks", description = "Receive push events from git hosts")
public class WebhookController {

    private static final Logger LOG = LoggerFactory.getLogger(
            WebhookController.class);

    private final PushEventChangeDetector pushDetector;

    /**
     * Creates a new WebhookController.
     *
     * @param thePushDetector the push event detector
     */
    public WebhookController(final PushEventChangeDetector thePushDetector) {
        this.pushDetector = thePushDetector;
    }

    /**
     * Records a push event.
     *
     * @param request the pushed repository and its new tip
     * @return whether the event was recorded or ignored
     */
    @Operation(
            summary = "Receive a push event",
            description = "Bursts of pushes to one repository collapse into a single sync. "
                    + "A push whose tip the checkout is already at is ignored."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Event accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid repository")
    })
    @PostMapping("/push")
    public ResponseEntity<PushResponse> push(
            @RequestBody final PushRequest request) {

        final RepositoryRef repo = RepositoryRef.of(
                request.host() != null && !request.host().isBlank()
                        ? request.host() : RepositoryRef.DEFAULT_HOST,
                request.owner(),
                request.name());
        LOG.debug("Push event for {} at {}", repo, request.tip());

        final boolean recorded = pushDetector.onPush(
                new PushEvent(repo, request.tip()));
        return ResponseEntity.accepted()
                .body(new PushResponse(repo.identifier(), recorded));
    }

    /**
     * A push event.
     *
     * @param host the git host (optional, defaults to github.com)
     * @param owner the repository owner
     * @param name the repository name
     * @param tip the new head commit (optional)
     */
    public record PushRequest(
            String host,
            String owner,
            String name,
            String tip
    ) {}

    /**
     * Response to a push event.
     *
     * @param repository the canonical repository identifier
     * @param recorded false if the event was ignored
     */
    public record PushResponse(
            String repository,
            boolean recorded
    ) {}

}
