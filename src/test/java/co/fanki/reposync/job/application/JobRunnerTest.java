package co.fanki.reposync.job.application;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.credential.domain.CredentialResolver;
import co.fanki.reposync.credential.domain.CredentialScope;
import co.fanki.reposync.credential.domain.InMemorySecretStore;
import co.fanki.reposync.job.domain.InMemoryJobRepository;
import co.fanki.reposync.job.domain.Job;
import co.fanki.reposync.job.domain.JobState;
import co.fanki.reposync.job.domain.ReanalysisRequest;
import co.fanki.reposync.job.domain.ReanalysisTrigger;
import co.fanki.reposync.job.domain.RetryPolicy;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.sync.domain.AuthException;
import co.fanki.reposync.sync.domain.CancellationToken;
import co.fanki.reposync.sync.domain.CorruptWorkspaceException;
import co.fanki.reposync.sync.domain.NetworkException;
import co.fanki.reposync.sync.domain.ScriptedSyncEngine;
import co.fanki.reposync.sync.domain.SyncCancelledException;
import co.fanki.reposync.sync.domain.SyncResult;
import co.fanki.reposync.workflow.domain.InMemoryWorkflowReportLog;
import co.fanki.reposync.workflow.domain.WorkflowReport;
import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for JobRunner.
 *
 * <p>The sync engine is scripted; credentials, jobs and reports live in
 * memory.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class JobRunnerTest {

    private final RepositoryRef repo = RepositoryRef.of("github.com", "acme",
            "widgets");

    private InMemorySecretStore secretStore;
    private ScriptedSyncEngine engine;
    private ReanalysisTrigger trigger;
    private InMemoryJobRepository jobRepository;
    private InMemoryWorkflowReportLog reportLog;
    private JobRunner runner;

    @BeforeEach
    void setUp() {
        secretStore = new InMemorySecretStore();
        secretStore.putDefault(handle(CredentialMethod.PAT));
        engine = new ScriptedSyncEngine();
        trigger = createMock(ReanalysisTrigger.class);
        jobRepository = new InMemoryJobRepository();
        reportLog = new InMemoryWorkflowReportLog();
        runner = new JobRunner(
                new CredentialResolver(secretStore, Clock.systemUTC()),
                engine,
                new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5),
                        0.0, new Random(7)),
                trigger, jobRepository, reportLog, 2, Clock.systemUTC());
    }

    @Test
    void whenRunning_givenFirstSync_shouldHandOffEveryFileAndReport() {
        final Capture<ReanalysisRequest> handedOff = newCapture();
        trigger.trigger(capture(handedOff));
        replay(trigger);
        final Job job = Job.create(repo, null);

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(JobState.REPORTED, job.state());
        assertTrue(report.succeeded());
        assertTrue(report.fullSync());
        assertEquals(ScriptedSyncEngine.FILES.size(),
                report.changedPathCount());
        assertEquals(CredentialMethod.PAT, report.credentialMethod());
        assertEquals(ScriptedSyncEngine.FILES,
                handedOff.getValue().changedPaths());
        assertTrue(handedOff.getValue().full());
        assertEquals(job.watermark(), handedOff.getValue().watermark());
        assertEquals(1, reportLog.since(Instant.EPOCH).count());
        assertEquals(JobState.REPORTED,
                jobRepository.findByRepository(repo).orElseThrow().state());
    }

    @Test
    void whenRunning_givenRemoteAtWatermark_shouldSkipHandOff() {
        replay(trigger);
        final Job job = syncedJob();
        engine.then(request -> SyncResult.noChange(
                request.previousWatermark(), Duration.ZERO));

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(JobState.REPORTED, report.state());
        assertEquals(0, report.changedPathCount());
        assertEquals("c0", job.watermark().commitId());
    }

    @Test
    void whenRunning_givenPersistentNetworkFailure_shouldFailAfterMaxAttempts() {
        replay(trigger);
        final Job job = Job.create(repo, null);
        for (int i = 0; i < 5; i++) {
            engine.thenThrow(new NetworkException("connection reset", null));
        }

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(3, engine.calls());
        assertEquals(JobState.FAILED, report.state());
        assertEquals(ErrorKind.NETWORK, report.errorKind());
        assertEquals(3, report.attempts());
        assertNull(job.watermark());
    }

    @Test
    void whenRunning_givenTransientNetworkFailure_shouldRetryAndSucceed() {
        trigger.trigger(anyObject(ReanalysisRequest.class));
        replay(trigger);
        final Job job = Job.create(repo, null);
        engine.thenThrow(new NetworkException("timeout", null));

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(2, engine.calls());
        assertEquals(JobState.REPORTED, report.state());
        assertEquals(2, report.attempts());
        assertTrue(report.succeeded());
    }

    @Test
    void whenRunning_givenRejectedCredential_shouldFallBackToNextBest() {
        trigger.trigger(anyObject(ReanalysisRequest.class));
        replay(trigger);
        secretStore.putDefault(handle(CredentialMethod.FINE_GRAINED_PAT));
        final Job job = Job.create(repo, null);
        engine.thenThrow(new AuthException("not authorized", null));

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(2, engine.calls());
        assertEquals(CredentialMethod.FINE_GRAINED_PAT,
                engine.requests().get(0).credential().method());
        assertEquals(CredentialMethod.PAT,
                engine.requests().get(1).credential().method());
        assertEquals(JobState.REPORTED, report.state());
        assertEquals(CredentialMethod.PAT, report.credentialMethod());
    }

    @Test
    void whenRunning_givenRejectedCredentialWithoutAlternative_shouldFail() {
        replay(trigger);
        final Job job = Job.create(repo, null);
        engine.thenThrow(new AuthException("not authorized", null));

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(1, engine.calls());
        assertEquals(JobState.FAILED, report.state());
        assertEquals(ErrorKind.AUTH, report.errorKind());
    }

    @Test
    void whenRunning_givenCorruptWorkspace_shouldForceOneReclone() {
        trigger.trigger(anyObject(ReanalysisRequest.class));
        replay(trigger);
        final Job job = syncedJob();
        engine.thenThrow(new CorruptWorkspaceException("no .git", null));

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertFalse(engine.requests().get(0).forceReclone());
        assertTrue(engine.requests().get(1).forceReclone());
        assertEquals(JobState.REPORTED, report.state());
        assertTrue(report.fullSync());
    }

    @Test
    void whenRunning_givenCorruptWorkspaceTwice_shouldFail() {
        replay(trigger);
        final Job job = syncedJob();
        engine.thenThrow(new CorruptWorkspaceException("no .git", null))
                .thenThrow(new CorruptWorkspaceException("still broken", null));

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(2, engine.calls());
        assertEquals(JobState.FAILED, report.state());
        assertEquals(ErrorKind.CORRUPT_WORKSPACE, report.errorKind());
        assertEquals("c0", job.watermark().commitId());
    }

    @Test
    void whenRunning_givenNoUsableCredential_shouldFailWithoutSyncing() {
        replay(trigger);
        final JobRunner bare = new JobRunner(
                new CredentialResolver(new InMemorySecretStore(),
                        Clock.systemUTC()),
                engine,
                new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5),
                        0.0, new Random(7)),
                trigger, jobRepository, reportLog, 1, Clock.systemUTC());
        final Job job = Job.create(repo, null);

        final WorkflowReport report = bare.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(0, engine.calls());
        assertEquals(JobState.FAILED, report.state());
        assertEquals(ErrorKind.NO_USABLE_CREDENTIAL, report.errorKind());
        assertEquals(0, report.attempts());
    }

    @Test
    void whenRunning_givenCancelledMidSync_shouldReportWithLastKnownState() {
        replay(trigger);
        final Job job = Job.create(repo, null);
        engine.thenThrow(new SyncCancelledException("cancelled", null));

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        assertEquals(JobState.REPORTED, report.state());
        assertEquals(JobState.SYNCING, report.lastKnownState());
        assertEquals(ErrorKind.CANCELLED, report.errorKind());
        assertEquals(1, reportLog.since(Instant.EPOCH).count());
    }

    @Test
    void whenRunning_givenCancellationDuringBackoff_shouldStopRetrying() {
        replay(trigger);
        final Job job = Job.create(repo, null);
        final CancellationToken token = new CancellationToken();
        engine.then(request -> {
            token.cancel();
            throw new NetworkException("connection reset", null);
        });

        final WorkflowReport report = runner.runPass(job, token);

        assertEquals(1, engine.calls());
        assertEquals(JobState.REPORTED, report.state());
        assertEquals(JobState.RETRY_SCHEDULED, report.lastKnownState());
        assertEquals(ErrorKind.CANCELLED, report.errorKind());
    }

    @Test
    void whenRunning_givenAlreadyCancelledToken_shouldReportWithoutSyncing() {
        replay(trigger);
        final Job job = Job.create(repo, null);
        final CancellationToken token = new CancellationToken();
        token.cancel();

        final WorkflowReport report = runner.runPass(job, token);

        assertEquals(0, engine.calls());
        assertEquals(JobState.REPORTED, report.state());
        assertEquals(JobState.PENDING, report.lastKnownState());
    }

    @Test
    void whenRunning_givenFailingHandOff_shouldStillReport() {
        trigger.trigger(anyObject(ReanalysisRequest.class));
        expectLastCall().andThrow(new IllegalStateException("consumer down"));
        replay(trigger);
        final Job job = Job.create(repo, null);

        final WorkflowReport report = runner.runPass(job,
                new CancellationToken());

        verify(trigger);
        assertEquals(JobState.REPORTED, report.state());
        assertTrue(report.succeeded());
    }

    @Test
    void whenRunning_givenFinishedJob_shouldRearmAndStartFromWatermark() {
        trigger.trigger(anyObject(ReanalysisRequest.class));
        replay(trigger);
        final Job job = syncedJob();

        runner.runPass(job, new CancellationToken());

        assertEquals("c0", engine.requests().get(0).previousWatermark()
                .commitId());
        assertEquals(2, runner.availableSyncPermits());
    }

    private Job syncedJob() {
        final Instant now = Instant.now();
        final Job job = Job.reconstitute("job-1", repo, null,
                JobState.REPORTED, 1, null, Watermark.at("c0", now),
                List.of(), CredentialMethod.PAT, null, now, now);
        jobRepository.save(job);
        return job;
    }

    private static CredentialHandle handle(final CredentialMethod method) {
        return CredentialHandle.of(method, "secret-" + method, null,
                CredentialScope.READ_ONLY);
    }

}
