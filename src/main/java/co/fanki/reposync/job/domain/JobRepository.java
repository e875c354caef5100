package co.fanki.reposync.job.domain;

import co.fanki.reposync.repository.domain.RepositoryRef;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of jobs, one per repository.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface JobRepository {

    /**
     * Inserts or updates a job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Finds the job of a repository.
     *
     * @param repository the repository
     * @return the job if found
     */
    Optional<Job> findByRepository(RepositoryRef repository);

    /**
     * Finds all jobs.
     *
     * @return every stored job
     */
    List<Job> findAll();

}
