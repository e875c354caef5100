package co.fanki.reposync.job.domain;

import co.fanki.reposync.credential.domain.CredentialMethod;
import co.fanki.reposync.repository.domain.RepositoryRef;
import co.fanki.reposync.repository.domain.Watermark;
import co.fanki.reposync.shared.ErrorKind;
import co.fanki.reposync.sync.domain.SyncMode;
import co.fanki.reposync.sync.domain.SyncResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for JdbiJobRepository using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class JdbiJobRepositoryIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:14")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private Jdbi jdbi;

    @Autowired
    private ObjectMapper objectMapper;

    private JdbiJobRepository repository;

    private final RepositoryRef repo = RepositoryRef.of("github.com", "acme",
            "widgets");

    @BeforeEach
    void setUp() {
        repository = new JdbiJobRepository(jdbi, objectMapper,
                Clock.systemUTC());
        jdbi.useHandle(handle -> handle.execute("DELETE FROM jobs"));
    }

    @Test
    void whenSavingJob_givenNewJob_shouldPersist() {
        final Job job = Job.create(repo, CredentialMethod.ANONYMOUS);

        repository.save(job);

        final Optional<Job> found = repository.findByRepository(repo);
        assertTrue(found.isPresent());
        assertEquals(job.id(), found.get().id());
        assertEquals(JobState.PENDING, found.get().state());
        assertEquals(CredentialMethod.ANONYMOUS, found.get().accessHint());
        assertNull(found.get().watermark());
    }

    @Test
    void whenSavingJob_givenCompletedPass_shouldKeepWatermarkAndHistory() {
        final Job job = Job.create(repo, null);
        job.dispatch();
        job.startSyncAttempt(CredentialMethod.PAT);
        job.syncSucceeded(SyncResult.full(null, Watermark.at("abc123", T0),
                List.of("README.md", "pom.xml"), SyncMode.INITIAL_CLONE,
                Duration.ofMillis(1500)));
        job.reanalysisHandedOff();

        repository.save(job);

        final Job found = repository.findByRepository(repo).orElseThrow();
        assertEquals(JobState.REPORTED, found.state());
        assertEquals(1, found.attempt());
        assertEquals(Watermark.at("abc123", T0), found.watermark());
        assertEquals(CredentialMethod.PAT, found.lastCredentialMethod());
        assertEquals(1, found.history().size());
        final SyncResult result = found.history().get(0);
        assertEquals(List.of("README.md", "pom.xml"), result.changedPaths());
        assertEquals(SyncMode.INITIAL_CLONE, result.mode());
        assertEquals(Duration.ofMillis(1500), result.duration());
    }

    @Test
    void whenSavingJob_givenExistingRepository_shouldUpdateInPlace() {
        final Job job = Job.create(repo, null);
        repository.save(job);
        job.dispatch();
        job.fail(new JobError(ErrorKind.NO_USABLE_CREDENTIAL, "none"));

        repository.save(job);

        final List<Job> all = repository.findAll();
        assertEquals(1, all.size());
        assertEquals(JobState.FAILED, all.get(0).state());
        assertEquals(ErrorKind.NO_USABLE_CREDENTIAL,
                all.get(0).lastError().kind());
    }

    @Test
    void whenFindingJob_givenUnknownRepository_shouldReturnEmpty() {
        assertTrue(repository.findByRepository(RepositoryRef.of("github.com",
                "acme", "unknown")).isEmpty());
    }

    @Test
    void whenFindingAll_givenInterruptedJob_shouldKeepLastKnownState() {
        final Job job = Job.create(repo, null);
        job.dispatch();
        job.startSyncAttempt(CredentialMethod.PAT);
        job.interrupt();
        repository.save(job);

        final Job found = repository.findAll().get(0);

        assertEquals(JobState.REPORTED, found.state());
        assertEquals(JobState.SYNCING, found.lastKnownState());
        assertEquals(ErrorKind.CANCELLED, found.lastError().kind());
    }

}
