package co.fanki.reposync.detection.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.Preconditions;

/**
 * A push notification received from the git host.
 *
 * @param repository the repository pushed to
 * @param tip the commit the default branch points at after the push,
 *        may be null when the host does not send it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PushEvent(RepositoryRef repository, String tip) {

    /** Validates the components. */
    public PushEvent {
        Preconditions.requireNonNull(repository, "Repository is required");
    }

}
