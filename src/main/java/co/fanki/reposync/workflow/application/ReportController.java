package co.fanki.reposync.workflow.application;

import co.fanki.reposync.workflow.domain.WorkflowReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * REST controller for the workflow report stream.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/reports")
@Tag(name = "Reports", description = "Audit trail of sync passes")
public class ReportController {

    /** Upper bound of reports returned by one request. */
    static final int MAX_REPORTS = 1000;

    private final WorkflowCoordinator coordinator;

    /**
     * Creates a new ReportController.
     *
     * @param theCoordinator the workflow coordinator
     */
    public ReportController(final WorkflowCoordinator theCoordinator) {
        this.coordinator = theCoordinator;
    }

    /**
     * Lists the reports created at or after an instant, oldest first.
     *
     * <p>Reports are ordered by creation time, then by ID. Passing the
     * {@code nextSince} and {@code nextAfter} of a response as
     * {@code since} and {@code after} returns the following page without
     * repeating any report.</p>
     *
     * @param since the lower bound, inclusive; the epoch when omitted
     * @param after ID of the last report already received; reports
     *        created exactly at {@code since} up to and including it are
     *        skipped. Ignored without {@code since}
     * @return at most {@value #MAX_REPORTS} reports
     */
    @Operation(summary = "List workflow reports",
            description = "Returns reports ordered by creation time, then by ID. Page by "
                    + "passing nextSince and nextAfter of the response as since and after.")
    @GetMapping
    public ResponseEntity<ReportListResponse> listReports(
            @Parameter(description = "ISO-8601 instant, inclusive",
                    example = "2024-01-01T00:00:00Z")
            @RequestParam(value = "since", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            final Instant since,
            @Parameter(description = "ID of the last report received")
            @RequestParam(value = "after", required = false)
            final String after) {

        final Instant from = since != null ? since : Instant.EPOCH;
        final String cursor = since != null ? after : null;

        final List<WorkflowReport> page;
        try (Stream<WorkflowReport> reports = coordinator.reportsSince(from)) {
            page = reports
                    .filter(report -> isPastCursor(report, from, cursor))
                    .limit(MAX_REPORTS)
                    .toList();
        }

        if (page.isEmpty()) {
            return ResponseEntity.ok(new ReportListResponse(page, from, cursor));
        }
        final WorkflowReport last = page.get(page.size() - 1);
        return ResponseEntity.ok(new ReportListResponse(page,
                last.createdAt(), last.id()));
    }

    private static boolean isPastCursor(final WorkflowReport report,
            final Instant since, final String after) {
        if (after == null || report.createdAt().isAfter(since)) {
            return true;
        }
        return report.id().compareTo(after) > 0;
    }

    /**
     * Response containing a page of reports and the cursor of the next one.
     */
    public record ReportListResponse(
            List<WorkflowReport> reports,
            Instant nextSince,
            String nextAfter
    ) {}

}
