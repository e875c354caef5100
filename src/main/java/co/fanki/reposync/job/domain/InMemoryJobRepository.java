package co.fanki.reposync.job.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process local {@link JobRepository}.
 *
 * <p>Jobs are kept by reference, so what the coordinator saves is what
 * it reads back.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryJobRepository implements JobRepository {

    private final ConcurrentMap<RepositoryRef, Job> jobs =
            new ConcurrentHashMap<>();

    @Override
    public void save(final Job job) {
        jobs.put(job.repository(), job);
    }

    @Override
    public Optional<Job> findByRepository(final RepositoryRef repository) {
        return Optional.ofNullable(jobs.get(repository));
    }

    @Override
    public List<Job> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::createdAt))
                .toList();
    }

}
