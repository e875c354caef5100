package co.fanki.reposync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Repository Sync Orchestrator Application.
 *
 * <p>Takes repositories from "known to exist" to "cloned, current and
 * reported on": it resolves credentials, clones or incrementally syncs
 * each repository, detects later changes through webhooks and polling,
 * and appends an audit report for every pass.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@EnableScheduling
public class RepoSyncApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(RepoSyncApplication.class, args);
    }

}
