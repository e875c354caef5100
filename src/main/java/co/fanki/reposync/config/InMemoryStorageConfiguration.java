package co.fanki.reposync.config;

import co.fanki.reposync.job.domain.InMemoryJobRepository;
import co.fanki.reposync.job.domain.JobRepository;
import co.fanki.reposync.workflow.domain.InMemoryWorkflowReportLog;
import co.fanki.reposync.workflow.domain.WorkflowReportLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Keeps jobs and reports in process memory.
 *
 * <p>Active with {@code orchestrator.store=memory}, for running without
 * a database. Nothing survives a restart.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "orchestrator.store", havingValue = "memory")
public class InMemoryStorageConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            InMemoryStorageConfiguration.class);

    /**
     * Provides the job store.
     *
     * @return the job store
     */
    @Bean
    public JobRepository jobRepository() {
        LOG.warn("Jobs and reports are kept in memory only");
        return new InMemoryJobRepository();
    }

    @Bean
    public WorkflowReportLog workflowReportLog() {
        return new InMemoryWorkflowReportLog();
    }

}
