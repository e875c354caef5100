package co.fanki.reposync.detection.application;

import co.fanki.reposync.detection.domain.PollingChangeDetector;
import co.fanki.reposync.detection.domain.PushEvent;
import co.fanki.reposync.detection.domain.PushEventChangeDetector;
import co.fanki.reposync.job.domain.InMemoryJobRepository;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.shared.MutableClock;
import co.fanki.reposync.workflow.application.WorkflowCoordinator;
import co.fanki.reposync.workflow.application.WorkflowCoordinator.EnqueueOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for ChangeDetectionScheduler.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ChangeDetectionSchedulerTest {

    private final RepositoryRef widgets = RepositoryRef.of("github.com",
            "acme", "widgets");
    private final RepositoryRef gadgets = RepositoryRef.of("github.com",
            "acme", "gadgets");

    private MutableClock clock;
    private WorkflowCoordinator coordinator;
    private PushEventChangeDetector pushDetector;
    private PollingChangeDetector pollingDetector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        coordinator = createMock(WorkflowCoordinator.class);
        pollingDetector = createMock(PollingChangeDetector.class);
        pushDetector = new PushEventChangeDetector(new InMemoryJobRepository(),
                clock, Duration.ofSeconds(10));
    }

    @Test
    void whenDetecting_givenSettledPushForNewRepository_shouldEnqueueIt() {
        expect(coordinator.knownRepositories()).andReturn(Set.of()).times(2);
        expect(coordinator.enqueue(widgets))
                .andReturn(EnqueueOutcome.SCHEDULED);
        replay(coordinator, pollingDetector);

        final ChangeDetectionScheduler scheduler = new ChangeDetectionScheduler(
                coordinator, pushDetector, pollingDetector, false);
        pushDetector.onPush(new PushEvent(widgets, "abc"));

        assertEquals(0, scheduler.detectChanges());
        clock.advance(Duration.ofSeconds(11));
        assertEquals(1, scheduler.detectChanges());

        verify(coordinator, pollingDetector);
    }

    @Test
    void whenDetecting_givenPollingEnabled_shouldEnqueueOnlyMovedRepositories() {
        expect(coordinator.knownRepositories())
                .andReturn(Set.of(widgets, gadgets));
        expect(pollingDetector.shouldSync(widgets)).andReturn(true);
        expect(pollingDetector.shouldSync(gadgets)).andReturn(false);
        expect(coordinator.enqueue(widgets))
                .andReturn(EnqueueOutcome.SCHEDULED);
        replay(coordinator, pollingDetector);

        final ChangeDetectionScheduler scheduler = new ChangeDetectionScheduler(
                coordinator, pushDetector, pollingDetector, true);

        assertEquals(1, scheduler.detectChanges());

        verify(coordinator, pollingDetector);
    }

    @Test
    void whenDetecting_givenFailingRepository_shouldKeepCheckingOthers() {
        expect(coordinator.knownRepositories())
                .andReturn(Set.of(widgets, gadgets));
        expect(pollingDetector.shouldSync(widgets))
                .andThrow(new IllegalStateException("boom"));
        expect(pollingDetector.shouldSync(gadgets)).andReturn(true);
        expect(coordinator.enqueue(gadgets))
                .andReturn(EnqueueOutcome.QUEUED_AFTER_CURRENT);
        replay(coordinator, pollingDetector);

        final ChangeDetectionScheduler scheduler = new ChangeDetectionScheduler(
                coordinator, pushDetector, pollingDetector, true);

        assertEquals(1, scheduler.detectChanges());

        verify(coordinator, pollingDetector);
    }

    @Test
    void whenDetecting_givenShuttingDownCoordinator_shouldNotCountRejected() {
        expect(coordinator.knownRepositories()).andReturn(Set.of(widgets));
        expect(pollingDetector.shouldSync(widgets)).andReturn(true);
        expect(coordinator.enqueue(widgets))
                .andReturn(EnqueueOutcome.REJECTED);
        replay(coordinator, pollingDetector);

        final ChangeDetectionScheduler scheduler = new ChangeDetectionScheduler(
                coordinator, pushDetector, pollingDetector, true);

        assertEquals(0, scheduler.detectChanges());

        verify(coordinator, pollingDetector);
    }

}
