package co.fanki.reposync.config;

import co.fanki.reposync.job.domain.JdbiJobRepository;
import co.fanki.reposync.job.domain.JobRepository;
import co.fanki.reposync.workflow.domain.JdbiWorkflowReportLog;
import co.fanki.reposync.workflow.domain.WorkflowReportLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * PostgreSQL backed job store and report log, through JDBI3.
 *
 * <p>Active with {@code orchestrator.store=jdbc}, the default. The
 * schema is created by the Flyway migrations under
 * {@code db/migration}. Job history and report payloads are JSONB
 * columns written with the application's Jackson mapper.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "orchestrator.store", havingValue = "jdbc",
        matchIfMissing = true)
public class DatabaseConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            DatabaseConfiguration.class);

    /**
     * Creates the JDBI instance.
     *
     * @param dataSource the data source to use
     * @return configured JDBI instance
     */
    @Bean
    public Jdbi jdbi(final DataSource dataSource) {
        LOG.info("Storing jobs and reports in PostgreSQL");
        return Jdbi.create(dataSource).installPlugin(new PostgresPlugin());
    }

    /**
     * Provides the job store.
     *
     * @param jdbi the JDBI instance
     * @param objectMapper mapper for the history column
     * @param clock the clock loaded jobs stamp their changes with
     * @return the job store
     */
    @Bean
    public JobRepository jobRepository(final Jdbi jdbi,
            final ObjectMapper objectMapper, final Clock clock) {
        return new JdbiJobRepository(jdbi, objectMapper, clock);
    }

    /**
     * Provides the report log.
     *
     * @param jdbi the JDBI instance
     * @param objectMapper mapper for the report payload
     * @return the report log
     */
    @Bean
    public WorkflowReportLog workflowReportLog(final Jdbi jdbi,
            final ObjectMapper objectMapper) {
        return new JdbiWorkflowReportLog(jdbi, objectMapper);
    }

}
