package co.fanki.reposync.job.domain;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.repository.domain.Protocol;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.DomainException;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.sync.domain.SyncMode;
import co.fanki.reposync.sync.domain.SyncResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL backed {@link JobRepository}.
 *
 * <p>Jobs are keyed by {@code (host, owner, name)}. The bounded sync
 * history is stored as JSONB. Credentials are never stored, only the tag
 * of the method used last.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JdbiJobRepository implements JobRepository {

    /** Find job by repository. Uses: UNIQUE constraint on (host, owner, name). */
    public static final String FIND_BY_REPOSITORY =
            "SELECT * FROM jobs WHERE host = :host AND owner = :owner"
                    + " AND name = :name";

    /** Find all jobs. Uses: seq scan (one row per repository). */
    public static final String FIND_ALL =
            "SELECT * FROM jobs ORDER BY created_at";

    private static final TypeReference<List<HistoryEntry>> HISTORY_TYPE =
            new TypeReference<>() { };

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Creates a new JdbiJobRepository.
     *
     * @param theJdbi the JDBI instance
     * @param theObjectMapper the mapper used for the history column
     * @param theClock the clock loaded jobs stamp their changes with
     */
    public JdbiJobRepository(final Jdbi theJdbi,
            final ObjectMapper theObjectMapper, final Clock theClock) {
        this.jdbi = theJdbi;
        this.objectMapper = theObjectMapper;
        this.clock = theClock;
    }

    @Override
    public void save(final Job job) {
        final JobSnapshot snapshot = job.snapshot();
        final RepositoryRef repo = job.repository();
        final Watermark watermark = job.watermark();
        final JobError lastError = snapshot.lastError();
        final String history = writeHistory(job.history());

        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO jobs (
                    id, host, owner, name, protocol, access_hint, state,
                    attempt, last_error_kind, last_error_message,
                    watermark_commit, watermark_synced_at,
                    last_credential_method, last_known_state, history,
                    created_at, updated_at
                ) VALUES (
                    :id, :host, :owner, :name, :protocol, :accessHint, :state,
                    :attempt, :lastErrorKind, :lastErrorMessage,
                    :watermarkCommit, :watermarkSyncedAt,
                    :lastCredentialMethod, :lastKnownState,
                    CAST(:history AS JSONB), :createdAt, :updatedAt
                )
                ON CONFLICT (host, owner, name) DO UPDATE SET
                    protocol = EXCLUDED.protocol,
                    access_hint = EXCLUDED.access_hint,
                    state = EXCLUDED.state,
                    attempt = EXCLUDED.attempt,
                    last_error_kind = EXCLUDED.last_error_kind,
                    last_error_message = EXCLUDED.last_error_message,
                    watermark_commit = EXCLUDED.watermark_commit,
                    watermark_synced_at = EXCLUDED.watermark_synced_at,
                    last_credential_method = EXCLUDED.last_credential_method,
                    last_known_state = EXCLUDED.last_known_state,
                    history = EXCLUDED.history,
                    updated_at = EXCLUDED.updated_at
                """)
                .bind("id", job.id())
                .bind("host", repo.host())
                .bind("owner", repo.owner())
                .bind("name", repo.name())
                .bind("protocol", repo.protocol().name())
                .bind("accessHint", nameOf(job.accessHint()))
                .bind("state", snapshot.state().name())
                .bind("attempt", snapshot.attempt())
                .bind("lastErrorKind", lastError != null
                        ? lastError.kind().name() : null)
                .bind("lastErrorMessage", lastError != null
                        ? lastError.message() : null)
                .bind("watermarkCommit", watermark != null
                        ? watermark.commitId() : null)
                .bind("watermarkSyncedAt", toTimestamp(watermark != null
                        ? watermark.syncedAt() : null))
                .bind("lastCredentialMethod",
                        nameOf(snapshot.lastCredentialMethod()))
                .bind("lastKnownState", nameOf(snapshot.lastKnownState()))
                .bind("history", history)
                .bind("createdAt", toTimestamp(job.createdAt()))
                .bind("updatedAt", toTimestamp(snapshot.updatedAt()))
                .execute());
    }

    @Override
    public Optional<Job> findByRepository(final RepositoryRef repository) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_REPOSITORY)
                .bind("host", repository.host())
                .bind("owner", repository.owner())
                .bind("name", repository.name())
                .map(new JobRowMapper())
                .findOne());
    }

    @Override
    public List<Job> findAll() {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_ALL)
                .map(new JobRowMapper())
                .list());
    }

    private String writeHistory(final List<SyncResult> results) {
        final List<HistoryEntry> entries = results.stream()
                .map(HistoryEntry::of)
                .toList();
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Cannot serialize sync history",
                    "JOB_HISTORY_SERIALIZATION", e);
        }
    }

    private List<SyncResult> readHistory(final String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, HISTORY_TYPE).stream()
                    .map(HistoryEntry::toResult)
                    .toList();
        } catch (final JsonProcessingException e) {
            throw new DomainException("Cannot read sync history",
                    "JOB_HISTORY_SERIALIZATION", e);
        }
    }

    private static String nameOf(final Enum<?> value) {
        return value != null ? value.name() : null;
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(final Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    /** Stored form of a sync result. */
    record HistoryEntry(
            String beforeCommit,
            Instant beforeSyncedAt,
            String afterCommit,
            Instant afterSyncedAt,
            List<String> changedPaths,
            SyncMode mode,
            long durationMillis) {

        static HistoryEntry of(final SyncResult result) {
            final Watermark before = result.before();
            return new HistoryEntry(
                    before != null ? before.commitId() : null,
                    before != null ? before.syncedAt() : null,
                    result.after().commitId(),
                    result.after().syncedAt(),
                    result.changedPaths(),
                    result.mode(),
                    result.duration().toMillis());
        }

        SyncResult toResult() {
            final Watermark before = beforeCommit != null
                    ? Watermark.at(beforeCommit, beforeSyncedAt) : null;
            return new SyncResult(before,
                    Watermark.at(afterCommit, afterSyncedAt),
                    changedPaths, mode, Duration.ofMillis(durationMillis));
        }
    }

    private final class JobRowMapper implements RowMapper<Job> {

        @Override
        public Job map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final RepositoryRef repository = RepositoryRef.of(
                    rs.getString("host"),
                    rs.getString("owner"),
                    rs.getString("name"),
                    Protocol.valueOf(rs.getString("protocol")));

            final String accessHint = rs.getString("access_hint");
            final String errorKind = rs.getString("last_error_kind");
            final JobError lastError = errorKind != null
                    ? new JobError(ErrorKind.valueOf(errorKind),
                            rs.getString("last_error_message"))
                    : null;

            final String commit = rs.getString("watermark_commit");
            final Watermark watermark = commit != null
                    ? Watermark.at(commit,
                            toInstant(rs.getTimestamp("watermark_synced_at")))
                    : null;

            final String lastMethod = rs.getString("last_credential_method");
            final String lastKnownState = rs.getString("last_known_state");

            return Job.reconstitute(
                    rs.getString("id"),
                    repository,
                    accessHint != null
                            ? CredentialMethod.valueOf(accessHint) : null,
                    JobState.valueOf(rs.getString("state")),
                    rs.getInt("attempt"),
                    lastError,
                    watermark,
                    readHistory(rs.getString("history")),
                    lastMethod != null
                            ? CredentialMethod.valueOf(lastMethod) : null,
                    lastKnownState != null
                            ? JobState.valueOf(lastKnownState) : null,
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    clock);
        }
    }

}
