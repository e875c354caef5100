package co.fanki.reposync.config;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.credential.domain.CredentialResolver;
import co.fanki.reposync.credential.domain.InMemorySecretStore;
import co.fanki.reposync.credential.domain.SecretStore;
import co.fanki.reposync.detection.domain.PollingChangeDetector;
import co.fanki.reposync.detection.domain.PushEventChangeDetector;
import co.fanki.reposync.job.application.ApplicationEventReanalysisTrigger;
import co.fanki.reposync.job.application.JobRunner;
import co.fanki.reposync.job.domain.JobRepository;
import co.fanki.reposync.job.domain.ReanalysisTrigger;
import co.fanki.reposync.job.domain.RetryPolicy;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.WorkspaceLayout;
import co.fanki.reposync.repository.domain.WorkspaceLocks;
import co.fanki.reposync.sync.domain.GitAuthentication;
import co.fanki.reposync.sync.domain.GitRemoteTipProbe;
import co.fanki.reposync.sync.domain.GitSyncEngine;
import co.fanki.reposync.sync.domain.RemoteTipProbe;
import co.fanki.reposync.sync.domain.SyncEngine;
import co.fanki.reposync.workflow.application.WorkflowCoordinator;
import co.fanki.reposync.workflow.domain.WorkflowReportLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the orchestrator's components.
 *
 * <p>Domain classes carry no Spring annotations; they are assembled
 * here from {@code orchestrator.*} settings.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OrchestratorConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            OrchestratorConfiguration.class);

    /**
     * Provides the clock shared by every time dependent component.
     *
     * @return the UTC system clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Provides the workspace layout.
     *
     * @param workspaceRoot directory holding every checkout
     * @return the layout
     */
    @Bean
    public WorkspaceLayout workspaceLayout(
            @Value("${orchestrator.workspace-root:./workspace}")
            final Path workspaceRoot) {
        LOG.info("Workspace root: {}", workspaceRoot.toAbsolutePath());
        return new WorkspaceLayout(workspaceRoot);
    }

    /**
     * Provides the per-repository workspace locks.
     *
     * @return the locks
     */
    @Bean
    public WorkspaceLocks workspaceLocks() {
        return new WorkspaceLocks();
    }

    /**
     * Builds the secret store from {@code orchestrator.secrets}.
     *
     * @param properties the orchestrator properties
     * @return the secret store
     */
    @Bean
    public SecretStore secretStore(final OrchestratorProperties properties) {
        final InMemorySecretStore store = new InMemorySecretStore();
        for (final OrchestratorProperties.SecretEntry entry
                : properties.getSecrets()) {
            final CredentialHandle handle = CredentialHandle.of(
                    entry.getMethod(), entry.getValue(),
                    entry.getExpiresAt(), entry.getScope());
            if (entry.getRepository() == null
                    || entry.getRepository().isBlank()) {
                store.putDefault(handle);
            } else {
                store.put(RepositoryRef.parseIdentifier(entry.getRepository()),
                        handle);
            }
            LOG.info("Loaded {} credential for {} (expires {})",
                    entry.getMethod(),
                    entry.getRepository() != null ? entry.getRepository() : "*",
                    entry.getExpiresAt());
        }
        return store;
    }

    /**
     * Provides the credential resolver.
     *
     * @param secretStore the secret store
     * @param clock the clock
     * @return the resolver
     */
    @Bean
    public CredentialResolver credentialResolver(final SecretStore secretStore,
            final Clock clock) {
        return new CredentialResolver(secretStore, clock);
    }

    /**
     * Provides the git transport authentication.
     *
     * @return the authentication
     */
    @Bean
    public GitAuthentication gitAuthentication() {
        return new GitAuthentication();
    }

    /**
     * Provides the JGit sync engine and clears leftovers of a previous
     * run from its staging area.
     *
     * @param layout the workspace layout
     * @param locks the workspace locks
     * @param authentication the git authentication
     * @param transferTimeout idle timeout of clones and fetches
     * @param clock the clock
     * @return the engine
     */
    @Bean
    public GitSyncEngine syncEngine(
            final WorkspaceLayout layout,
            final WorkspaceLocks locks,
            final GitAuthentication authentication,
            @Value("${orchestrator.sync.transfer-timeout:300s}")
            final Duration transferTimeout,
            final Clock clock) {
        final GitSyncEngine engine = new GitSyncEngine(layout, locks,
                authentication, RepositoryRef::cloneUrl, transferTimeout, clock);
        engine.purgeStaleStaging();
        return engine;
    }

    /**
     * Provides the remote tip probe used for polling.
     *
     * @param authentication the git authentication
     * @param timeout the probe timeout
     * @return the probe
     */
    @Bean
    public RemoteTipProbe remoteTipProbe(
            final GitAuthentication authentication,
            @Value("${orchestrator.detection.probe-timeout:30s}")
            final Duration timeout) {
        return new GitRemoteTipProbe(authentication, RepositoryRef::cloneUrl,
                timeout);
    }

    /**
     * Provides the retry policy.
     *
     * @param maxAttempts sync attempts per pass
     * @param initialBackoff delay after the first failure
     * @param maxBackoff cap of any delay
     * @param jitter randomized share of a delay
     * @return the policy
     */
    @Bean
    public RetryPolicy retryPolicy(
            @Value("${orchestrator.retry.max-attempts:3}") final int maxAttempts,
            @Value("${orchestrator.retry.initial-backoff:2s}")
            final Duration initialBackoff,
            @Value("${orchestrator.retry.max-backoff:60s}")
            final Duration maxBackoff,
            @Value("${orchestrator.retry.jitter:0.5}") final double jitter) {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, jitter,
                new Random());
    }

    /**
     * Provides the re-analysis trigger.
     *
     * @param publisher the Spring event publisher
     * @return the trigger
     */
    @Bean
    public ReanalysisTrigger reanalysisTrigger(
            final ApplicationEventPublisher publisher) {
        return new ApplicationEventReanalysisTrigger(publisher);
    }

    /**
     * Provides the job runner.
     *
     * @param credentialResolver the credential resolver
     * @param syncEngine the sync engine
     * @param retryPolicy the retry policy
     * @param reanalysisTrigger the re-analysis trigger
     * @param jobRepository the job store
     * @param reportLog the report sink
     * @param maxConcurrentSyncs how many syncs may run at once
     * @param clock the clock
     * @return the runner
     */
    @Bean
    public JobRunner jobRunner(
            final CredentialResolver credentialResolver,
            final SyncEngine syncEngine,
            final RetryPolicy retryPolicy,
            final ReanalysisTrigger reanalysisTrigger,
            final JobRepository jobRepository,
            final WorkflowReportLog reportLog,
            @Value("${orchestrator.max-concurrent-syncs:2}")
            final int maxConcurrentSyncs,
            final Clock clock) {
        return new JobRunner(credentialResolver, syncEngine, retryPolicy,
                reanalysisTrigger, jobRepository, reportLog,
                maxConcurrentSyncs, clock);
    }

    /**
     * Provides the workflow coordinator and its worker pool.
     *
     * @param jobRepository the job store
     * @param jobRunner the job runner
     * @param reportLog the report sink
     * @param workers size of the worker pool
     * @param shutdownGrace how long shutdown waits for passes to report
     * @param clock the clock
     * @return the coordinator, shut down with the context
     */
    @Bean(destroyMethod = "shutdown")
    public WorkflowCoordinator workflowCoordinator(
            final JobRepository jobRepository,
            final JobRunner jobRunner,
            final WorkflowReportLog reportLog,
            @Value("${orchestrator.workers:4}") final int workers,
            @Value("${orchestrator.shutdown-grace:30s}")
            final Duration shutdownGrace,
            final Clock clock) {
        return new WorkflowCoordinator(jobRepository, jobRunner, reportLog,
                Executors.newFixedThreadPool(workers,
                        workerThreadFactory()),
                shutdownGrace, clock);
    }

    /**
     * Provides the polling change detector.
     *
     * @param jobRepository the job store
     * @param credentialResolver the credential resolver
     * @param remoteTipProbe the remote tip probe
     * @return the detector
     */
    @Bean
    public PollingChangeDetector pollingChangeDetector(
            final JobRepository jobRepository,
            final CredentialResolver credentialResolver,
            final RemoteTipProbe remoteTipProbe) {
        return new PollingChangeDetector(jobRepository, credentialResolver,
                remoteTipProbe);
    }

    /**
     * Provides the push event change detector.
     *
     * @param jobRepository the job store
     * @param clock the clock
     * @param debounceWindow quiet time required after the last push
     * @return the detector
     */
    @Bean
    public PushEventChangeDetector pushEventChangeDetector(
            final JobRepository jobRepository,
            final Clock clock,
            @Value("${orchestrator.detection.debounce-window:10s}")
            final Duration debounceWindow) {
        return new PushEventChangeDetector(jobRepository, clock,
                debounceWindow);
    }

    private static ThreadFactory workerThreadFactory() {
        final AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            final Thread thread = new Thread(runnable,
                    "repo-sync-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }

}
