package co.fanki.reposync.repository.domain;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-repository read/write locks guarding the checkout directories.
 *
 * <p>The sync engine holds the write lock for a repository while it
 * mutates its checkout. Components that read a checkout, such as a
 * downstream analyzer, take the read lock, so they never observe a tree
 * halfway through a fast-forward or a re-clone swap.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class WorkspaceLocks {

    private final ConcurrentMap<RepositoryRef, ReentrantReadWriteLock> locks =
            new ConcurrentHashMap<>();

    /**
     * Returns the lock readers must hold while reading a checkout.
     *
     * @param repo the repository
     * @return the shared lock
     */
    public Lock readLock(final RepositoryRef repo) {
        return lockOf(repo).readLock();
    }

    /**
     * Returns the lock the engine holds while mutating a checkout.
     *
     * @param repo the repository
     * @return the exclusive lock
     */
    public Lock writeLock(final RepositoryRef repo) {
        return lockOf(repo).writeLock();
    }

    private ReentrantReadWriteLock lockOf(final RepositoryRef repo) {
        return locks.computeIfAbsent(repo, r -> new ReentrantReadWriteLock(true));
    }

}
