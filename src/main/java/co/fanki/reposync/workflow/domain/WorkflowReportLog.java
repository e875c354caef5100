package co.fanki.reposync.workflow.domain;

import java.time.Instant;
import java.util.stream.Stream;

/**
 * Append-only sink of workflow reports.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface WorkflowReportLog {

    /**
     * Appends a report. Reports are never updated or removed.
     *
     * @param report the report
     */
    void append(WorkflowReport report);

    /**
     * Streams the reports created at or after an instant, oldest first.
     *
     * <p>The stream is finite and lazy, and every call starts a new one.
     * Callers must close it.</p>
     *
     * @param since the lower bound, inclusive
     * @return the reports
     */
    Stream<WorkflowReport> since(Instant since);

}
