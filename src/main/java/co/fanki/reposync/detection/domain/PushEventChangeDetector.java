package co.fanki.reposync.detection.domain;

import co.fanki.reposync.job.domain.Job;
import co.fanki.reposync.job.domain.JobRepository;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Debounces push events into sync requests.
 *
 * <p>Events for one repository arriving within the debounce window of
 * each other collapse into a single pending request. The request
 * becomes due once the window has passed since the last event, and
 * {@link #shouldSync} reports it exactly once.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PushEventChangeDetector implements ChangeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            PushEventChangeDetector.class);

    private final JobRepository jobRepository;
    private final Clock clock;
    private final Duration debounceWindow;

    private final ConcurrentMap<RepositoryRef, Pending> pending =
            new ConcurrentHashMap<>();

    /**
     * Creates a new PushEventChangeDetector.
     *
     * @param theJobRepository where watermarks are read from
     * @param theClock the clock used for the debounce window
     * @param theDebounceWindow quiet time required after the last event
     */
    public PushEventChangeDetector(final JobRepository theJobRepository,
            final Clock theClock, final Duration theDebounceWindow) {
        this.jobRepository = Preconditions.requireNonNull(theJobRepository,
                "Job repository is required");
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
        Preconditions.requireNonNull(theDebounceWindow,
                "Debounce window is required");
        Preconditions.require(!theDebounceWindow.isNegative(),
                "Debounce window cannot be negative");
        this.debounceWindow = theDebounceWindow;
    }

    /**
     * Records a push event.
     *
     * @param event the event
     * @return false if the event was ignored because the checkout is
     *         already at its tip
     */
    public boolean onPush(final PushEvent event) {
        Preconditions.requireNonNull(event, "Push event is required");
        final RepositoryRef repo = event.repository();

        if (event.tip() != null) {
            final Watermark watermark = jobRepository.findByRepository(repo)
                    .map(Job::watermark)
                    .orElse(null);
            if (watermark != null && watermark.isAt(event.tip())) {
                LOG.debug("Ignoring push for {}: already at {}", repo,
                        event.tip());
                return false;
            }
        }

        final Pending merged = pending.merge(repo,
                new Pending(event.tip(), clock.instant(), 1),
                (previous, next) -> new Pending(next.tip(),
                        next.lastEventAt(), previous.events() + 1));
        LOG.debug("Push for {} recorded ({} event(s) pending)", repo,
                merged.events());
        return true;
    }

    @Override
    public boolean shouldSync(final RepositoryRef repo) {
        final Pending current = pending.get(repo);
        if (current == null) {
            return false;
        }
        final Duration quiet = Duration.between(current.lastEventAt(),
                clock.instant());
        if (quiet.compareTo(debounceWindow) < 0) {
            return false;
        }
        final boolean due = pending.remove(repo, current);
        if (due) {
            LOG.info("{} push event(s) for {} collapsed into one sync",
                    current.events(), repo);
        }
        return due;
    }

    /**
     * Returns the repositories with events waiting for their window.
     *
     * @return a snapshot of the pending repositories
     */
    public Set<RepositoryRef> pendingRepositories() {
        return Set.copyOf(pending.keySet());
    }

    private record Pending(String tip, Instant lastEventAt, int events) {
    }

}
