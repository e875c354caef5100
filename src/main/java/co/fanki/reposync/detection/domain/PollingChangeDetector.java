package co.fanki.reposync.detection.domain;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.credential.domain.CredentialResolver;
import co.fanki.reposync.job.domain.Job;
import co.fanki.reposync.job.domain.JobError;
import co.fanki.reposync.job.domain.JobRepository;
import co.fanki.reposync.job.domain.JobState;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.DomainException;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.shared.Preconditions;
import co.fanki.reposync.sync.domain.RemoteTipProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compares the remote tip with the stored watermark.
 *
 * <p>A repository without a watermark is due, unless its last pass
 * failed because no credential got through; such a repository waits for
 * an explicit enqueue or a push event. Probe and credential failures are
 * logged and answer false; the next poll asks again.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PollingChangeDetector implements ChangeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            PollingChangeDetector.class);

    private static final Set<ErrorKind> NEEDS_INTERVENTION = EnumSet.of(
            ErrorKind.NO_USABLE_CREDENTIAL, ErrorKind.AUTH);

    private final JobRepository jobRepository;
    private final CredentialResolver credentialResolver;
    private final RemoteTipProbe remoteTipProbe;

    /**
     * Creates a new PollingChangeDetector.
     *
     * @param theJobRepository where watermarks are read from
     * @param theCredentialResolver picks the credential for the probe
     * @param theRemoteTipProbe reads remote tips
     */
    public PollingChangeDetector(final JobRepository theJobRepository,
            final CredentialResolver theCredentialResolver,
            final RemoteTipProbe theRemoteTipProbe) {
        this.jobRepository = Preconditions.requireNonNull(theJobRepository,
                "Job repository is required");
        this.credentialResolver = Preconditions.requireNonNull(
                theCredentialResolver, "Credential resolver is required");
        this.remoteTipProbe = Preconditions.requireNonNull(theRemoteTipProbe,
                "Remote tip probe is required");
    }

    @Override
    public boolean shouldSync(final RepositoryRef repo) {
        final Optional<Job> job = jobRepository.findByRepository(repo);
        final Watermark watermark = job.map(Job::watermark).orElse(null);
        if (watermark == null) {
            if (job.isPresent() && failedForCredentials(job.get())) {
                LOG.debug("{} was never synced and its last pass failed with"
                        + " {}, waiting for an explicit request", repo,
                        job.get().lastError().kind());
                return false;
            }
            LOG.debug("{} was never synced, due", repo);
            return true;
        }

        final List<CredentialMethod> candidates = job.get()
                .credentialCandidates();
        try {
            final CredentialHandle credential = credentialResolver.resolve(
                    repo, candidates);
            final Optional<String> tip = remoteTipProbe.remoteTip(repo,
                    credential);
            if (tip.isEmpty()) {
                LOG.debug("{} has no remote tip", repo);
                return false;
            }
            final boolean changed = !watermark.isAt(tip.get());
            if (changed) {
                LOG.info("Remote tip of {} moved from {} to {}", repo,
                        watermark.commitId(), tip.get());
            }
            return changed;
        } catch (final DomainException e) {
            LOG.warn("Polling {} failed ({}): {}", repo, e.getErrorCode(),
                    e.getMessage());
            return false;
        }
    }

    private static boolean failedForCredentials(final Job job) {
        final JobError error = job.lastError();
        return job.state() == JobState.FAILED && error != null
                && NEEDS_INTERVENTION.contains(error.kind());
    }

}
