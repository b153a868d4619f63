package io.github.yok.doltsync.dolt;

import io.github.yok.doltsync.util.CloseableIterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Version-control operations the sync engine needs from a Dolt database.
 *
 * <p>
 * Commit arguments are resolved commit hashes unless stated otherwise. Iterators hold database
 * resources and must be closed by the caller.
 * </p>
 */
public interface VersionControl {

    /**
     * Resolves a ref (branch, tag, {@code HEAD}, {@code HEAD~1}, hash) to a commit hash.
     *
     * @param ref ref
     * @return commit hash
     * @throws io.github.yok.doltsync.exception.RefNotFoundException if the ref does not resolve
     */
    String resolveCommit(String ref);

    /**
     * Lists the commits reachable from {@code toInclusive} but not from {@code fromExclusive},
     * oldest first.
     *
     * @param fromExclusive commit already synchronized
     * @param toInclusive target commit
     * @return commits, ending with {@code toInclusive}; empty when nothing is newer
     */
    List<String> listCommits(String fromExclusive, String toInclusive);

    /**
     * Returns the columns of a table at a commit.
     *
     * @param table table name
     * @param commit commit hash
     * @return column names in table order, or empty when the table does not exist at the commit
     */
    Optional<List<String>> tableColumns(String table, String commit);

    /**
     * Streams the row-level diff of a table between two commits in a deterministic order.
     *
     * @param table table name
     * @param fromCommit from-commit
     * @param toCommit to-commit
     * @return diff rows
     */
    CloseableIterator<RowDiff> diffRows(String table, String fromCommit, String toCommit);

    /**
     * Streams all rows of a table at a commit.
     *
     * @param table table name
     * @param commit commit hash
     * @param orderBy columns defining a stable order
     * @return rows
     */
    CloseableIterator<Map<String, Object>> snapshotRows(String table, String commit,
            List<String> orderBy);

    /**
     * Stages the given tables and commits the working set.
     *
     * @param message commit message
     * @param tables tables to stage
     * @return hash of the new commit, or the current {@code HEAD} when nothing was staged
     */
    String commitChanges(String message, List<String> tables);

    /**
     * Switches the session to a branch, creating it from the current {@code HEAD} when missing.
     * Later calls to {@link #resolveCommit} with {@code HEAD} and to {@link #commitChanges} act on
     * that branch.
     *
     * @param branch branch name
     */
    void checkoutBranch(String branch);
}
