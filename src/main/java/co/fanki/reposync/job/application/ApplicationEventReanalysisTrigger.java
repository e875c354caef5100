package co.fanki.reposync.job.application;

import co.fanki.reposync.job.domain.ReanalysisRequest;
import co.fanki.reposync.job.domain.ReanalysisTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Publishes re-analysis requests as {@link RepositoryChangedEvent}s.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ApplicationEventReanalysisTrigger implements ReanalysisTrigger {

    private static final Logger LOG = LoggerFactory.getLogger(
            ApplicationEventReanalysisTrigger.class);

    private final ApplicationEventPublisher publisher;

    /**
     * Creates a new ApplicationEventReanalysisTrigger.
     *
     * @param thePublisher the Spring event publisher
     */
    public ApplicationEventReanalysisTrigger(
            final ApplicationEventPublisher thePublisher) {
        this.publisher = thePublisher;
    }

    @Override
    public void trigger(final ReanalysisRequest request) {
        LOG.debug("Publishing change of {} at {} ({} paths, full={})",
                request.repository(), request.watermark().commitId(),
                request.changedPaths().size(), request.full());
        publisher.publishEvent(new RepositoryChangedEvent(
                request.repository(),
                request.watermark(),
                request.changedPaths(),
                request.full()));
    }

}
