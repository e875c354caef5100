package co.fanki.reposync.workflow.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Process local {@link WorkflowReportLog}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryWorkflowReportLog implements WorkflowReportLog {

    private final List<WorkflowReport> reports = new ArrayList<>();

    @Override
    public synchronized void append(final WorkflowReport report) {
        reports.add(report);
    }

    @Override
    public Stream<WorkflowReport> since(final Instant since) {
        final List<WorkflowReport> copy;
        synchronized (this) {
            copy = List.copyOf(reports);
        }
        return copy.stream()
                .filter(report -> !report.createdAt().isBefore(since))
                .sorted(Comparator.comparing(WorkflowReport::createdAt)
                        .thenComparing(WorkflowReport::id));
    }

}
