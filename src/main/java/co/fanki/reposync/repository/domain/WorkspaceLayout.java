package co.fanki.reposync.repository.domain;

import co.fanki.reposync.shared.Preconditions;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Deterministic on-disk layout of repository checkouts.
 *
 * <pre>
 *   &lt;root&gt;/&lt;owner&gt;_&lt;name&gt;/        working tree + .git
 *   &lt;root&gt;/.staging/&lt;owner&gt;_&lt;name&gt;-&lt;id&gt;/  clone in progress
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class WorkspaceLayout {

    private static final String STAGING = ".staging";

    private final Path root;

    /**
     * Creates a layout rooted at the given directory.
     *
     * @param theRoot the workspace root, not null
     */
    public WorkspaceLayout(final Path theRoot) {
        this.root = Preconditions.requireNonNull(theRoot,
                "Workspace root is required").toAbsolutePath().normalize();
    }

    /**
     * Returns the checkout directory for a repository.
     *
     * @param repo the repository
     * @return the checkout directory, which may not exist yet
     */
    public Path checkoutOf(final RepositoryRef repo) {
        return root.resolve(repo.workspaceDirectoryName());
    }

    /**
     * Returns a fresh staging directory for a clone of a repository.
     *
     * <p>Staging lives under the same root so that the final move into
     * place stays on one file system.</p>
     *
     * @param repo the repository
     * @return a staging path that does not exist yet
     */
    public Path newStagingDirectory(final RepositoryRef repo) {
        return stagingRoot().resolve(repo.workspaceDirectoryName() + "-"
                + UUID.randomUUID());
    }

    /**
     * Returns the directory holding all staged clones.
     *
     * @return the staging root
     */
    public Path stagingRoot() {
        return root.resolve(STAGING);
    }

    public Path root() {
        return root;
    }

}
