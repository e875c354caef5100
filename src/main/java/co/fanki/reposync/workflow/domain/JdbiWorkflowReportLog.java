package co.fanki.reposync.workflow.domain;

import co.fanki.reposync.shared.DomainException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.stream.Stream;

/**
 * PostgreSQL backed {@link WorkflowReportLog}.
 *
 * <p>The searchable fields live in columns; the whole report is kept as
 * a JSONB payload for audit.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JdbiWorkflowReportLog implements WorkflowReportLog {

    /** Reports created since an instant. Uses: idx_workflow_reports_created_at. */
    public static final String FIND_SINCE =
            "SELECT payload FROM workflow_reports WHERE created_at >= :since"
                    + " ORDER BY created_at, id COLLATE \"C\"";

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;

    /**
     * Creates a new JdbiWorkflowReportLog.
     *
     * @param theJdbi the JDBI instance
     * @param theObjectMapper the mapper used for the payload column
     */
    public JdbiWorkflowReportLog(final Jdbi theJdbi,
            final ObjectMapper theObjectMapper) {
        this.jdbi = theJdbi;
        this.objectMapper = theObjectMapper;
    }

    @Override
    public void append(final WorkflowReport report) {
        final String payload = write(report);
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO workflow_reports (
                    id, repository, state, error_kind, created_at, payload
                ) VALUES (
                    :id, :repository, :state, :errorKind, :createdAt,
                    CAST(:payload AS JSONB)
                )
                """)
                .bind("id", report.id())
                .bind("repository", report.repository())
                .bind("state", report.state().name())
                .bind("errorKind", report.errorKind() != null
                        ? report.errorKind().name() : null)
                .bind("createdAt", Timestamp.from(report.createdAt()))
                .bind("payload", payload)
                .execute());
    }

    @Override
    public Stream<WorkflowReport> since(final Instant since) {
        final Handle handle = jdbi.open();
        try {
            return handle.createQuery(FIND_SINCE)
                    .bind("since", Timestamp.from(since))
                    .mapTo(String.class)
                    .stream()
                    .map(this::read)
                    .onClose(handle::close);
        } catch (final RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    private String write(final WorkflowReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Cannot serialize workflow report",
                    "REPORT_SERIALIZATION", e);
        }
    }

    private WorkflowReport read(final String payload) {
        try {
            return objectMapper.readValue(payload, WorkflowReport.class);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Cannot read workflow report",
                    "REPORT_SERIALIZATION", e);
        }
    }

}
